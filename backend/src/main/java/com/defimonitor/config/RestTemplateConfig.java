package com.defimonitor.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per remote party so each gets its own bounded timeouts.
 */
@Configuration
public class RestTemplateConfig {

    private static final String USER_AGENT = "defi-monitor/1.0";

    @Bean
    @Qualifier("webhookRestTemplate")
    public RestTemplate webhookRestTemplate(AppProps props) {
        return buildRestTemplate(props.getSlack().getTimeoutMs());
    }

    @Bean
    @Qualifier("defiLlamaRestTemplate")
    public RestTemplate defiLlamaRestTemplate(AppProps props) {
        return buildRestTemplate(props.getDefillama().getTimeoutMs());
    }

    private RestTemplate buildRestTemplate(long timeoutMs) {
        RequestConfig rc = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setConnectTimeout(Timeout.ofMilliseconds(timeoutMs))
                .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(httpClient);
        f.setConnectTimeout((int) timeoutMs);

        RestTemplate rt = new RestTemplate(f);
        rt.getInterceptors().add((request, body, execution) -> {
            HttpHeaders h = request.getHeaders();
            h.set(HttpHeaders.USER_AGENT, USER_AGENT);
            return execution.execute(request, body);
        });
        return rt;
    }
}
