package com.autotask.simpleSDK.client;

import com.autotask.simpleSDK.http.AutotaskHttpClient;
import com.autotask.simpleSDK.http.DelayScheduler;
import com.autotask.simpleSDK.http.RequestHandler;
import com.autotask.simpleSDK.http.exceptions.AutotaskConfigurationException;
import com.autotask.simpleSDK.http.exceptions.AutotaskException;
import com.autotask.simpleSDK.http.recording.HttpInteractionRecorder;
import com.autotask.simpleSDK.http.retry.ExponentialBackoffStrategy;
import com.autotask.simpleSDK.http.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Wires an {@link AutotaskClient} from an {@link AutotaskConfig}. When the config has no API URL the
 * zone is detected first.
 */
public class AutotaskClientBuilder {
    private AutotaskConfig config;
    private HttpInteractionRecorder recorder;
    private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
    private Logger logger;
    private HttpClient httpClient;
    private DelayScheduler delayScheduler;
    private String zoneInformationUrl = ZoneDetector.ZONE_INFORMATION_URL;

    public AutotaskClientBuilder config(AutotaskConfig config) {
        this.config = config;
        return this;
    }

    public AutotaskClientBuilder recorder(HttpInteractionRecorder recorder) {
        this.recorder = recorder;
        return this;
    }

    public AutotaskClientBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /** Logger receiving request, retry and error logs. Defaults to the {@code AutotaskClient} logger. */
    public AutotaskClientBuilder logger(Logger logger) {
        this.logger = logger;
        return this;
    }

    public AutotaskClientBuilder httpClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        return this;
    }

    public AutotaskClientBuilder delayScheduler(DelayScheduler delayScheduler) {
        this.delayScheduler = delayScheduler;
        return this;
    }

    public AutotaskClientBuilder zoneInformationUrl(String zoneInformationUrl) {
        this.zoneInformationUrl = zoneInformationUrl;
        return this;
    }

    public CompletableFuture<AutotaskClient> buildAsync() {
        if (config == null) {
            return CompletableFuture.failedFuture(new AutotaskConfigurationException("Autotask configuration is required", "config"));
        }

        RequestHandler requestHandler = new RequestHandler(
            logger != null ? logger : LoggerFactory.getLogger(AutotaskClient.class),
            retryPolicy,
            config.getRequestOptions(),
            new ExponentialBackoffStrategy(),
            delayScheduler != null ? delayScheduler : DelayScheduler.systemDefault()
        );
        HttpClient transport = httpClient != null
            ? httpClient
            : HttpClient.newBuilder().connectTimeout(config.getTimeout()).build();

        if (config.getApiUrl().isPresent()) {
            return CompletableFuture.completedFuture(newClient(config.getApiUrl().get(), transport, requestHandler));
        }

        AutotaskHttpClient zoneClient = new AutotaskHttpClient(zoneInformationUrl, null, recorder, transport, config.getTimeout());
        return new ZoneDetector(zoneClient, requestHandler, zoneInformationUrl)
            .detectApiUrl(config.getUsername())
            .thenApply(apiUrl -> newClient(apiUrl, transport, requestHandler));
    }

    /**
     * Blocking variant of {@link #buildAsync()}; waits for zone detection when it is needed.
     */
    public AutotaskClient build() throws AutotaskException {
        try {
            return buildAsync().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AutotaskException("Interrupted while creating Autotask client", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AutotaskException) {
                throw (AutotaskException) e.getCause();
            }
            throw new AutotaskException("Failed to create Autotask client", e.getCause());
        }
    }

    private AutotaskClient newClient(String apiUrl, HttpClient transport, RequestHandler requestHandler) {
        AutotaskHttpClient autotaskHttpClient = new AutotaskHttpClient(apiUrl, config.toCredentials(), recorder, transport, config.getTimeout());
        return new AutotaskClient(autotaskHttpClient, requestHandler);
    }
}
