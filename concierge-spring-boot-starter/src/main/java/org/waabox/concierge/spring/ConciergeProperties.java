package org.waabox.concierge.spring;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import org.waabox.concierge.ChannelOptions;

/**
 * Configuration properties for Concierge, mapped from the
 * {@code concierge.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code concierge.instance-id} - the id of this instance; a random
 *       UUID when not set.</li>
 *   <li>{@code concierge.session-id} - the session shared by the
 *       instances that elect one leader.</li>
 *   <li>{@code concierge.base-url}, {@code concierge.request-timeout} -
 *       where the subscribe endpoint lives, used unless the application
 *       defines its own {@code CancellableRequest} bean.</li>
 *   <li>{@code concierge.resume-debounce} - the window in which repeated
 *       foreground triggers of the process are ignored.</li>
 *   <li>{@code concierge.options.*} - the default channel timings.</li>
 *   <li>{@code concierge.channels.<name>.filter} - channels registered at
 *       startup.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "concierge")
public class ConciergeProperties {

  /** The instance id, null means auto-generate UUID. */
  private String instanceId;

  /** The session id, null means the default session. */
  private String sessionId;

  /** The base URL of the realtime API. */
  private URI baseUrl;

  /** The timeout of one subscribe call, null means the default. */
  private Duration requestTimeout;

  /** The foreground debounce of the process, null means the default. */
  private Duration resumeDebounce;

  /** The default channel timings. */
  private Options options = new Options();

  /** The channels registered at startup, by name. */
  private Map<String, Channel> channels = new LinkedHashMap<>();

  public String getInstanceId() {
    return instanceId;
  }

  public void setInstanceId(final String theInstanceId) {
    instanceId = theInstanceId;
  }

  public String getSessionId() {
    return sessionId;
  }

  public void setSessionId(final String theSessionId) {
    sessionId = theSessionId;
  }

  public URI getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(final URI theBaseUrl) {
    baseUrl = theBaseUrl;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(final Duration theRequestTimeout) {
    requestTimeout = theRequestTimeout;
  }

  public Duration getResumeDebounce() {
    return resumeDebounce;
  }

  public void setResumeDebounce(final Duration theResumeDebounce) {
    resumeDebounce = theResumeDebounce;
  }

  public Options getOptions() {
    return options;
  }

  public void setOptions(final Options theOptions) {
    options = theOptions;
  }

  public Map<String, Channel> getChannels() {
    return channels;
  }

  public void setChannels(final Map<String, Channel> theChannels) {
    channels = theChannels;
  }

  /**
   * A channel registered from the properties.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static class Channel {

    /** The initial filter, null for none. */
    private String filter;

    public String getFilter() {
      return filter;
    }

    public void setFilter(final String theFilter) {
      filter = theFilter;
    }
  }

  /**
   * The channel timings. Unset values keep the library defaults.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static class Options {

    private Boolean leaderElectionEnabled;

    private Duration leaseTtl;

    private Duration leaseJitter;

    private Duration renewInterval;

    private Duration followerTickMin;

    private Duration followerTickMax;

    private Duration initialDelay;

    private Duration minDelay;

    private Duration maxDelay;

    private Duration heartbeatDelay;

    private Duration longPollWindow;

    private Double telemetrySampleRate;

    /**
     * Applies the values that are set over the library defaults.
     *
     * @return the channel options, never null
     *
     * @throws IllegalArgumentException if the values are inconsistent
     */
    public ChannelOptions toChannelOptions() {
      final ChannelOptions defaults = ChannelOptions.defaults();
      final ChannelOptions.Builder builder = defaults.toBuilder();
      if (leaderElectionEnabled != null) {
        builder.leaderElectionEnabled(leaderElectionEnabled);
      }
      if (leaseTtl != null) {
        builder.leaseTtl(leaseTtl);
      }
      if (leaseJitter != null) {
        builder.leaseJitter(leaseJitter);
      }
      if (renewInterval != null) {
        builder.renewInterval(renewInterval);
      }
      if (followerTickMin != null || followerTickMax != null) {
        builder.followerTick(
            followerTickMin != null
                ? followerTickMin : defaults.followerTickMin(),
            followerTickMax != null
                ? followerTickMax : defaults.followerTickMax());
      }
      if (initialDelay != null) {
        builder.initialDelay(initialDelay);
      }
      if (minDelay != null) {
        builder.minDelay(minDelay);
      }
      if (maxDelay != null) {
        builder.maxDelay(maxDelay);
      }
      if (heartbeatDelay != null) {
        builder.heartbeatDelay(heartbeatDelay);
      }
      if (longPollWindow != null) {
        builder.longPollWindow(longPollWindow);
      }
      if (telemetrySampleRate != null) {
        builder.telemetrySampleRate(telemetrySampleRate);
      }
      return builder.build();
    }

    public Boolean getLeaderElectionEnabled() {
      return leaderElectionEnabled;
    }

    public void setLeaderElectionEnabled(final Boolean enabled) {
      leaderElectionEnabled = enabled;
    }

    public Duration getLeaseTtl() {
      return leaseTtl;
    }

    public void setLeaseTtl(final Duration theLeaseTtl) {
      leaseTtl = theLeaseTtl;
    }

    public Duration getLeaseJitter() {
      return leaseJitter;
    }

    public void setLeaseJitter(final Duration theLeaseJitter) {
      leaseJitter = theLeaseJitter;
    }

    public Duration getRenewInterval() {
      return renewInterval;
    }

    public void setRenewInterval(final Duration theRenewInterval) {
      renewInterval = theRenewInterval;
    }

    public Duration getFollowerTickMin() {
      return followerTickMin;
    }

    public void setFollowerTickMin(final Duration theMin) {
      followerTickMin = theMin;
    }

    public Duration getFollowerTickMax() {
      return followerTickMax;
    }

    public void setFollowerTickMax(final Duration theMax) {
      followerTickMax = theMax;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(final Duration theInitialDelay) {
      initialDelay = theInitialDelay;
    }

    public Duration getMinDelay() {
      return minDelay;
    }

    public void setMinDelay(final Duration theMinDelay) {
      minDelay = theMinDelay;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(final Duration theMaxDelay) {
      maxDelay = theMaxDelay;
    }

    public Duration getHeartbeatDelay() {
      return heartbeatDelay;
    }

    public void setHeartbeatDelay(final Duration theHeartbeatDelay) {
      heartbeatDelay = theHeartbeatDelay;
    }

    public Duration getLongPollWindow() {
      return longPollWindow;
    }

    public void setLongPollWindow(final Duration theLongPollWindow) {
      longPollWindow = theLongPollWindow;
    }

    public Double getTelemetrySampleRate() {
      return telemetrySampleRate;
    }

    public void setTelemetrySampleRate(final Double theRate) {
      telemetrySampleRate = theRate;
    }
  }
}
