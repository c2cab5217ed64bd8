package com.slack.indexgateway.client;

/** Creates a client handle of type {@code C} for a gateway address. */
@FunctionalInterface
public interface ClientFactory<C> {
  C create(String address) throws Exception;
}
