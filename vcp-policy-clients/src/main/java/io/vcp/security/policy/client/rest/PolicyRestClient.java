// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vcp.security.policy.client.PolicyRestClientConfig;
import io.vcp.security.policy.client.provider.BasicAuthCredentialProvider;
import io.vcp.security.policy.client.provider.BuiltInAuthProviders;
import io.vcp.security.policy.client.rest.entities.ChangeStatus;
import io.vcp.security.policy.client.rest.entities.ErrorMessage;
import io.vcp.security.policy.client.rest.entities.ResourcePost;
import io.vcp.security.policy.client.rest.entities.ResourcePostResponse;
import io.vcp.security.policy.client.rest.exceptions.RestClientException;
import io.vcp.security.policy.utils.JsonMapper;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.utils.KafkaThread;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rest client for the policy server: project resource sync, permission lookups and
 * change notifications.
 */
public class PolicyRestClient implements Closeable {

  private static final Logger log = LoggerFactory.getLogger(PolicyRestClient.class);

  private static final int HTTP_CONNECT_TIMEOUT_MS = 60000;
  private static final int JSON_PARSE_ERROR_CODE = 50005;

  private static final String PROJECT_RESOURCES_END_POINT = "/api/service/v1/resources/project";
  private static final String PROJECT_PERMISSIONS_END_POINT = "/api/service/v1/resources/project/permissions-for-user";
  private static final String SERVER_PERMISSIONS_END_POINT = "/api/service/v1/resources/lxd/permissions-for-user";
  private static final String CHANGES_END_POINT = "/api/service/v1/changes";

  private static final TypeReference<ResourcePostResponse> RESOURCE_POST_RESPONSE_TYPE =
      new TypeReference<ResourcePostResponse>() { };
  private static final TypeReference<Map<String, List<String>>> PERMISSIONS_RESPONSE_TYPE =
      new TypeReference<Map<String, List<String>>>() { };
  private static final TypeReference<ChangeStatus> CHANGE_STATUS_TYPE =
      new TypeReference<ChangeStatus>() { };

  private static final ObjectMapper OBJECT_MAPPER = JsonMapper.objectMapper();

  private final Time time;
  private final List<String> policyServerUrls;
  private final int requestTimeout;
  private final int httpRequestTimeout;
  private final int changesTimeout;

  private BasicAuthCredentialProvider basicAuthCredentialProvider;
  private RequestSender requestSender;

  public PolicyRestClient(final Map<String, ?> configs) {
    this(configs, Time.SYSTEM);
  }

  public PolicyRestClient(final Map<String, ?> configs, final Time time) {
    this.time = time;
    PolicyRestClientConfig clientConfig = new PolicyRestClientConfig(configs);
    this.policyServerUrls = clientConfig.getList(PolicyRestClientConfig.API_URLS_PROP);
    this.requestTimeout = clientConfig.getInt(PolicyRestClientConfig.REQUEST_TIMEOUT_MS_CONFIG);
    this.httpRequestTimeout = clientConfig.getInt(PolicyRestClientConfig.HTTP_REQUEST_TIMEOUT_MS_CONFIG);
    this.changesTimeout = clientConfig.getInt(PolicyRestClientConfig.CHANGES_TIMEOUT_MS_CONFIG);

    String basicAuthProvider = clientConfig.getString(PolicyRestClientConfig.BASIC_AUTH_CREDENTIALS_PROVIDER_PROP);
    basicAuthCredentialProvider = BuiltInAuthProviders.loadBasicAuthCredentialProvider(basicAuthProvider);
    basicAuthCredentialProvider.configure(configs);

    requestSender = new HTTPRequestSender();
  }

  /**
   * Posts project resource updates. A 409 response is raised as a {@link RestClientException}
   * with status 409, which means that the caller's sync id is stale and a full sync is required.
   */
  public ResourcePostResponse postProjectResources(ResourcePost resourcePost)
      throws IOException, RestClientException {
    byte[] body = OBJECT_MAPPER.writeValueAsBytes(resourcePost);
    return httpRequest(PROJECT_RESOURCES_END_POINT, "POST", body, RESOURCE_POST_RESPONSE_TYPE,
        requestTimeout, httpRequestTimeout);
  }

  /**
   * Returns the permissions of a user keyed by project resource identifier.
   */
  public Map<String, List<String>> projectPermissionsForUser(String username)
      throws IOException, RestClientException {
    return httpRequest(userQuery(PROJECT_PERMISSIONS_END_POINT, username), "GET", null,
        PERMISSIONS_RESPONSE_TYPE, requestTimeout, httpRequestTimeout);
  }

  /**
   * Returns the server-wide permissions of a user. Server permissions are keyed by the empty string.
   */
  public Map<String, List<String>> serverPermissionsForUser(String username)
      throws IOException, RestClientException {
    return httpRequest(userQuery(SERVER_PERMISSIONS_END_POINT, username), "GET", null,
        PERMISSIONS_RESPONSE_TYPE, requestTimeout, httpRequestTimeout);
  }

  /**
   * Waits for the next change after {@code lastChange}, or for any change if it is null or empty.
   * The server holds the request open until a change occurs or its own gateway times out.
   */
  public ChangeStatus changes(String lastChange) throws IOException, RestClientException {
    String path = CHANGES_END_POINT;
    if (lastChange != null && !lastChange.isEmpty())
      path += "?last-change=" + URLEncoder.encode(lastChange, StandardCharsets.UTF_8.name());
    return httpRequest(path, "GET", null, CHANGE_STATUS_TYPE, changesTimeout, changesTimeout);
  }

  private String userQuery(String path, String username) throws IOException {
    return path + "?u=" + URLEncoder.encode(username, StandardCharsets.UTF_8.name());
  }

  private <T> T httpRequest(String path,
                            String method,
                            byte[] requestBodyData,
                            TypeReference<T> responseFormat,
                            long requestTimeout,
                            long attemptTimeout) throws IOException, RestClientException {
    UrlSelector urlSelector = new UrlSelector(policyServerUrls);
    long begin = time.milliseconds();
    long remainingWaitMs = requestTimeout;
    long elapsed;

    for (int i = 0, n = urlSelector.size(); i < n; i++) {
      String requestUrl = buildRequestUrl(urlSelector.current(), path);
      try {
        return requestSender.send(requestUrl,
            method,
            requestBodyData,
            responseFormat,
            Math.min(remainingWaitMs, attemptTimeout));
      } catch (IOException e) {
        log.debug("Request to {} failed", requestUrl, e);
        urlSelector.fail();
        if (i == n - 1) {
          throw e; // no more urls to try
        }
      }

      elapsed = time.milliseconds() - begin;
      if (elapsed >= requestTimeout) {
        throw new TimeoutException("Request aborted due to timeout.");
      }
      remainingWaitMs = requestTimeout - elapsed;
    }
    throw new IOException("Internal HTTP retry error"); // Can't get here
  }

  private String buildRequestUrl(String baseUrl, String path) {
    return baseUrl.replaceFirst("/$", "") + "/" + path.replaceFirst("^/", "");
  }

  private void setBasicAuthRequestHeader(HttpURLConnection connection) {
    String userInfo;
    if (basicAuthCredentialProvider != null
        && (userInfo = basicAuthCredentialProvider.getUserInfo()) != null) {
      String authHeader = Base64.getEncoder().encodeToString(userInfo.getBytes(StandardCharsets.UTF_8));
      connection.setRequestProperty("Authorization", "Basic " + authHeader);
    }
  }

  public void basicAuthCredentialProvider(final BasicAuthCredentialProvider basicAuthCredentialProvider) {
    this.basicAuthCredentialProvider = basicAuthCredentialProvider;
  }

  // Visible for testing
  void requestSender(RequestSender requestSender) {
    RequestSender previous = this.requestSender;
    this.requestSender = requestSender;
    if (previous instanceof HTTPRequestSender)
      ((HTTPRequestSender) previous).close();
  }

  @Override
  public void close() {
    if (requestSender instanceof HTTPRequestSender)
      ((HTTPRequestSender) requestSender).close();
  }

  private class HTTPRequestSender implements RequestSender {

    private final AtomicInteger threadCount = new AtomicInteger();
    private final ExecutorService executor = new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        1,
        TimeUnit.MINUTES,
        new SynchronousQueue<>(),
        r -> KafkaThread.daemon("policy-rest-client-" + threadCount.incrementAndGet(), r));

    @Override
    public <T> T send(final String requestUrl, final String method, final byte[] requestBodyData,
                      final TypeReference<T> responseFormat, final long requestTimeout)
        throws IOException, RestClientException {
      Future<T> f = submit(requestUrl, method, requestBodyData, responseFormat, requestTimeout);
      try {
        return f.get(requestTimeout, TimeUnit.MILLISECONDS);
      } catch (java.util.concurrent.TimeoutException e) {
        f.cancel(true);
        throw new SocketTimeoutException("No response from " + requestUrl + " within " + requestTimeout + " ms");
      } catch (InterruptedException e) {
        f.cancel(true);
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while waiting for " + requestUrl, e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RestClientException) {
          throw (RestClientException) cause;
        } else if (cause instanceof IOException) {
          throw (IOException) cause;
        } else {
          throw new RuntimeException(cause);
        }
      }
    }

    private <T> Future<T> submit(final String requestUrl, final String method, final byte[] requestBodyData,
                                 final TypeReference<T> responseFormat, final long requestTimeout) {
      return executor.submit(() -> {
        String requestData = requestBodyData == null
            ? "null"
            : new String(requestBodyData, StandardCharsets.UTF_8);
        log.debug("Sending {} with input {} to {}", method, requestData, requestUrl);
        HttpURLConnection connection = null;
        try {
          URL url = new URL(requestUrl);
          connection = (HttpURLConnection) url.openConnection();

          connection.setConnectTimeout(HTTP_CONNECT_TIMEOUT_MS);
          connection.setReadTimeout((int) Math.min(Integer.MAX_VALUE, requestTimeout));

          connection.setRequestMethod(method);
          setBasicAuthRequestHeader(connection);
          connection.setDoInput(true);
          connection.setRequestProperty("Content-Type", "application/json");
          connection.setUseCaches(false);

          if (requestBodyData != null) {
            connection.setDoOutput(true);
            try (OutputStream os = connection.getOutputStream()) {
              os.write(requestBodyData);
              os.flush();
            } catch (IOException e) {
              log.error("Failed to send HTTP request to endpoint: {}", url, e);
              throw e;
            }
          }

          int responseCode = connection.getResponseCode();
          if (responseCode == HttpURLConnection.HTTP_OK) {
            try (InputStream is = connection.getInputStream()) {
              return OBJECT_MAPPER.readValue(is, responseFormat);
            }
          } else if (responseCode == HttpURLConnection.HTTP_NO_CONTENT) {
            return null;
          } else {
            throw restClientException(connection, responseCode);
          }
        } finally {
          if (connection != null) {
            connection.disconnect();
          }
        }
      });
    }

    private RestClientException restClientException(HttpURLConnection connection, int responseCode)
        throws IOException {
      ErrorMessage errorMessage;
      try (InputStream es = connection.getErrorStream()) {
        if (es == null) {
          errorMessage = new ErrorMessage(responseCode, connection.getResponseMessage());
        } else {
          errorMessage = OBJECT_MAPPER.readValue(es, ErrorMessage.class);
        }
      } catch (JsonProcessingException e) {
        errorMessage = new ErrorMessage(JSON_PARSE_ERROR_CODE, e.getMessage());
      }
      return new RestClientException(errorMessage.message(), responseCode, errorMessage.errorCode());
    }

    void close() {
      executor.shutdownNow();
    }
  }
}
