// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest;

import com.fasterxml.jackson.core.type.TypeReference;
import io.vcp.security.policy.client.rest.exceptions.RestClientException;
import java.io.IOException;

public interface RequestSender {
  /**
   * @param <T>               The type of the deserialized response to the HTTP request.
   * @param requestUrl        HTTP connection will be established with this url.
   * @param method            HTTP method ("GET", "POST", etc.)
   * @param requestBodyData   Bytes to be sent in the request body, may be null.
   * @param responseFormat    Expected format of the response to the HTTP request.
   * @param requestTimeout    Maximum time in milliseconds to wait for this attempt.
   * @return The deserialized response to the HTTP request, or null if no data is expected.
   * @throws IOException if the server could not be reached or the attempt timed out
   * @throws RestClientException if the server responded with an error status
   */
  <T> T send(String requestUrl, String method, byte[] requestBodyData,
             TypeReference<T> responseFormat, long requestTimeout) throws IOException, RestClientException;
}
