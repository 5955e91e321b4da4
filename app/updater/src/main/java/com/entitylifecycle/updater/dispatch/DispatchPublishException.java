package com.entitylifecycle.updater.dispatch;

public class DispatchPublishException extends RuntimeException {

  public DispatchPublishException(String message) {
    super(message);
  }

  public DispatchPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
