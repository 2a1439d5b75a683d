package com.skyrelay.bridge.link;

import java.io.IOException;

/**
 * Link-level failure that is not a plain socket error: peer closed, silence timeout, unusable
 * device.
 *
 * <p>Always handled by the link reader loop, which degrades the connection and retries.
 */
public class LinkException extends IOException {
  public LinkException(String message) {
    super(message);
  }

  public LinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
