package io.courier.client;

import static org.junit.jupiter.api.Assertions.*;

import com.google.api.gax.grpc.GrpcStatusCode;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.ApiExceptionFactory;
import io.courier.CourierException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;

public class GrpcErrorHandlingTest {

  private static ApiException apiException(Status.Code code) {
    return ApiExceptionFactory.createException(
        new StatusRuntimeException(Status.fromCode(code)), GrpcStatusCode.of(code), false);
  }

  @Test
  public void testStatusCodeFromApiException() {
    assertTrue(GrpcErrorHandling.isAlreadyExists(apiException(Status.Code.ALREADY_EXISTS)));
    assertTrue(GrpcErrorHandling.isNotFound(apiException(Status.Code.NOT_FOUND)));
    assertFalse(GrpcErrorHandling.isNotFound(apiException(Status.Code.UNAVAILABLE)));
  }

  @Test
  public void testStatusCodeFromGrpcExceptions() {
    assertEquals(
        Status.Code.NOT_FOUND,
        GrpcErrorHandling.statusCode(Status.NOT_FOUND.asRuntimeException()));
    assertEquals(
        Status.Code.ABORTED, GrpcErrorHandling.statusCode(new StatusException(Status.ABORTED)));
  }

  @Test
  public void testStatusCodeFoundInCauseChain() {
    CourierException inner = new CourierException("inner", Status.ALREADY_EXISTS.asException());
    CourierException wrapped = new CourierException("outer", inner);

    assertTrue(GrpcErrorHandling.isAlreadyExists(wrapped));
  }

  @Test
  public void testUnknownWithoutStatus() {
    assertEquals(Status.Code.UNKNOWN, GrpcErrorHandling.statusCode(new IllegalStateException()));
    assertEquals(Status.Code.UNKNOWN, GrpcErrorHandling.statusCode(null));
  }
}
