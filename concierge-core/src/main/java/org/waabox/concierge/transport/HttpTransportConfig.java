package org.waabox.concierge.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for {@link HttpCancellableRequest}.
 *
 * <p>Holds the base URI of the API, the request timeout and the query
 * parameter names that carry the cursor and the filter.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpTransportConfig {

  /** The default request timeout, longer than the long-poll window. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(35);

  /** The default cursor query parameter. */
  private static final String DEFAULT_CURSOR_PARAM = "lastEventId";

  /** The default filter query parameter. */
  private static final String DEFAULT_FILTER_PARAM = "propertyId";

  /** The API base URI, never null. */
  private final URI baseUri;

  /** The request timeout, never null. */
  private final Duration requestTimeout;

  /** The cursor query parameter name, never null. */
  private final String cursorParam;

  /** The filter query parameter name, never null. */
  private final String filterParam;

  /** Private constructor; use the static factory methods instead. */
  private HttpTransportConfig(final URI theBaseUri,
      final Duration theRequestTimeout, final String theCursorParam,
      final String theFilterParam) {
    baseUri = Objects.requireNonNull(theBaseUri, "baseUri must not be null");
    requestTimeout = Objects.requireNonNull(theRequestTimeout,
        "requestTimeout must not be null");
    cursorParam = Objects.requireNonNull(theCursorParam,
        "cursorParam must not be null");
    filterParam = Objects.requireNonNull(theFilterParam,
        "filterParam must not be null");
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException(
          "requestTimeout must be positive, got: " + requestTimeout);
    }
  }

  /**
   * Creates a configuration with the default timeout and parameter names.
   *
   * @param baseUri the API base URI, never null
   * @return a new config, never null
   */
  public static HttpTransportConfig create(final URI baseUri) {
    return new HttpTransportConfig(baseUri, DEFAULT_TIMEOUT,
        DEFAULT_CURSOR_PARAM, DEFAULT_FILTER_PARAM);
  }

  /**
   * Creates a configuration with the default parameter names.
   *
   * @param baseUri        the API base URI, never null
   * @param requestTimeout the request timeout, never null
   * @return a new config, never null
   */
  public static HttpTransportConfig create(final URI baseUri,
      final Duration requestTimeout) {
    return new HttpTransportConfig(baseUri, requestTimeout,
        DEFAULT_CURSOR_PARAM, DEFAULT_FILTER_PARAM);
  }

  /**
   * Creates a fully specified configuration.
   *
   * @param baseUri        the API base URI, never null
   * @param requestTimeout the request timeout, never null
   * @param cursorParam    the cursor query parameter, never null
   * @param filterParam    the filter query parameter, never null
   * @return a new config, never null
   */
  public static HttpTransportConfig create(final URI baseUri,
      final Duration requestTimeout, final String cursorParam,
      final String filterParam) {
    return new HttpTransportConfig(baseUri, requestTimeout, cursorParam,
        filterParam);
  }

  /**
   * Returns the API base URI.
   *
   * @return the base URI, never null
   */
  public URI baseUri() {
    return baseUri;
  }

  /**
   * Returns the request timeout.
   *
   * @return the timeout, never null
   */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  /**
   * Returns the cursor query parameter name.
   *
   * @return the parameter name, never null
   */
  public String cursorParam() {
    return cursorParam;
  }

  /**
   * Returns the filter query parameter name.
   *
   * @return the parameter name, never null
   */
  public String filterParam() {
    return filterParam;
  }
}
