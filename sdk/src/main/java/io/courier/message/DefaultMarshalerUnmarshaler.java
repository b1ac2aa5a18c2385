package io.courier.message;

import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import io.courier.CourierException;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Default codec. Metadata travels as message attributes and the message uuid as the reserved
 * attribute {@value #UUID_ATTRIBUTE}.
 */
public class DefaultMarshalerUnmarshaler implements Marshaler, Unmarshaler {

  /** Attribute carrying the message uuid. It may not be used as a metadata key. */
  public static final String UUID_ATTRIBUTE = "_courier_message_uuid";

  @Nonnull
  @Override
  public PubsubMessage marshal(@Nonnull String topic, @Nonnull Message message) {
    if (message.getMetadata().containsKey(UUID_ATTRIBUTE)) {
      throw new CourierException(
          "Metadata key " + UUID_ATTRIBUTE + " is reserved for the message uuid");
    }
    Map<String, String> attributes = new HashMap<>(message.getMetadata());
    attributes.put(UUID_ATTRIBUTE, message.getUuid());

    return PubsubMessage.newBuilder()
        .setData(ByteString.copyFrom(message.getPayload()))
        .putAllAttributes(attributes)
        .build();
  }

  @Nonnull
  @Override
  public Message unmarshal(@Nonnull Envelope envelope) {
    Map<String, String> metadata = new HashMap<>(envelope.getAttributes());
    String uuid = metadata.remove(UUID_ATTRIBUTE);
    if (uuid == null) {
      uuid = envelope.getMessageId();
    }
    return new Message(uuid, metadata, envelope.getData().toByteArray());
  }
}
