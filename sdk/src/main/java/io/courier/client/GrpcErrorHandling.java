package io.courier.client;

import com.google.api.gax.rpc.ApiException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import javax.annotation.Nullable;

/** Utility for classifying gRPC and gax errors. */
public class GrpcErrorHandling {
  private GrpcErrorHandling() {}

  public static boolean isAlreadyExists(@Nullable Throwable error) {
    return statusCode(error) == Status.Code.ALREADY_EXISTS;
  }

  public static boolean isNotFound(@Nullable Throwable error) {
    return statusCode(error) == Status.Code.NOT_FOUND;
  }

  /**
   * Extracts the gRPC status code from an error or its causes.
   *
   * @return the status code, or {@link Status.Code#UNKNOWN} when none is attached
   */
  public static Status.Code statusCode(@Nullable Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof ApiException) {
        String name = ((ApiException) current).getStatusCode().getCode().name();
        return Status.Code.valueOf(name);
      }
      if (current instanceof StatusRuntimeException) {
        return ((StatusRuntimeException) current).getStatus().getCode();
      }
      if (current instanceof StatusException) {
        return ((StatusException) current).getStatus().getCode();
      }
      current = current.getCause();
    }
    return Status.Code.UNKNOWN;
  }
}
