package org.proxyrotor;

/** Thrown on a second read of a {@link ProxyResponse} body. */
public class BodyAlreadyConsumedException extends ProxyPoolException {
  private static final long serialVersionUID = 1L;

  public BodyAlreadyConsumedException() {
    super("Body has already been consumed");
  }
}
