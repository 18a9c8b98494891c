package com.bbthechange.tvguide.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Typed view of the {@code tvguide.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "tvguide")
public class TvGuideProperties {

    private String applicationName = "TvGuide";
    private String applicationVersion = "1.0.0";

    private final NowLive nowLive = new NowLive();
    private final Twitch twitch = new Twitch();
    private final Discord discord = new Discord();
    private final Internal internal = new Internal();

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }

    public String getApplicationVersion() {
        return applicationVersion;
    }

    public void setApplicationVersion(String applicationVersion) {
        this.applicationVersion = applicationVersion;
    }

    public NowLive getNowLive() {
        return nowLive;
    }

    public Twitch getTwitch() {
        return twitch;
    }

    public Discord getDiscord() {
        return discord;
    }

    public Internal getInternal() {
        return internal;
    }

    /**
     * Polling and persistence settings for the now-live poller.
     */
    public static class NowLive {

        private boolean enabled = true;

        private String userDataFile = "NowLiveUserData.json";

        private String activeBroadcastsFile = "ActiveBroadcasts.json";

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration updateInterval = Duration.ofSeconds(60);

        @DurationUnit(ChronoUnit.MINUTES)
        private Duration mediaRefreshInterval = Duration.ofMinutes(6);

        // Helix rejects more than 100 user_id parameters per request
        private int maxUsersPerRequest = 100;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUserDataFile() {
            return userDataFile;
        }

        public void setUserDataFile(String userDataFile) {
            this.userDataFile = userDataFile;
        }

        public String getActiveBroadcastsFile() {
            return activeBroadcastsFile;
        }

        public void setActiveBroadcastsFile(String activeBroadcastsFile) {
            this.activeBroadcastsFile = activeBroadcastsFile;
        }

        public Duration getUpdateInterval() {
            return updateInterval;
        }

        public void setUpdateInterval(Duration updateInterval) {
            this.updateInterval = updateInterval;
        }

        public Duration getMediaRefreshInterval() {
            return mediaRefreshInterval;
        }

        public void setMediaRefreshInterval(Duration mediaRefreshInterval) {
            this.mediaRefreshInterval = mediaRefreshInterval;
        }

        public int getMaxUsersPerRequest() {
            return maxUsersPerRequest;
        }

        public void setMaxUsersPerRequest(int maxUsersPerRequest) {
            this.maxUsersPerRequest = maxUsersPerRequest;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /**
     * Twitch application credentials and endpoints.
     */
    public static class Twitch {

        private String clientId = "";
        private String clientSecret = "";
        private String helixBaseUrl = "https://api.twitch.tv/helix";
        private String authBaseUrl = "https://id.twitch.tv/oauth2";

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration tokenExpirationBuffer = Duration.ofSeconds(300);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration connectTimeout = Duration.ofSeconds(10);

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getHelixBaseUrl() {
            return helixBaseUrl;
        }

        public void setHelixBaseUrl(String helixBaseUrl) {
            this.helixBaseUrl = helixBaseUrl;
        }

        public String getAuthBaseUrl() {
            return authBaseUrl;
        }

        public void setAuthBaseUrl(String authBaseUrl) {
            this.authBaseUrl = authBaseUrl;
        }

        public Duration getTokenExpirationBuffer() {
            return tokenExpirationBuffer;
        }

        public void setTokenExpirationBuffer(Duration tokenExpirationBuffer) {
            this.tokenExpirationBuffer = tokenExpirationBuffer;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    /**
     * Discord webhook target for the active broadcast messages.
     */
    public static class Discord {

        private boolean enabled = false;
        private String webhookUrl = "";
        private String guildId = "";
        private String channelId = "";
        private String footerIcon = "";
        private int onlineColor = 0x9146FF;
        private int offlineColor = 0x808080;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public String getGuildId() {
            return guildId;
        }

        public void setGuildId(String guildId) {
            this.guildId = guildId;
        }

        public String getChannelId() {
            return channelId;
        }

        public void setChannelId(String channelId) {
            this.channelId = channelId;
        }

        public String getFooterIcon() {
            return footerIcon;
        }

        public void setFooterIcon(String footerIcon) {
            this.footerIcon = footerIcon;
        }

        public int getOnlineColor() {
            return onlineColor;
        }

        public void setOnlineColor(int onlineColor) {
            this.onlineColor = onlineColor;
        }

        public int getOfflineColor() {
            return offlineColor;
        }

        public void setOfflineColor(int offlineColor) {
            this.offlineColor = offlineColor;
        }
    }

    public static class Internal {

        private String apiKey = "";

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}
