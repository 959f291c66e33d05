package com.continuum.relayer.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** HTTP clients for the ledger JSON-RPC endpoint and the signing service. */
@Configuration(proxyBeanMethods = false)
public class LedgerHttpConfig {

    @Bean
    public HttpClient ledgerHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public RestClient ledgerRpcRestClient(
            RelayerProperties relayerProperties, RestClient.Builder builder, HttpClient ledgerHttpClient) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(ledgerHttpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(relayerProperties.getLedger().getReadTimeoutMs()));

        return builder.clone()
                .baseUrl(relayerProperties.getLedger().getRpcUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }

    @Bean
    public RestClient signerRestClient(
            RelayerProperties relayerProperties, RestClient.Builder builder, HttpClient ledgerHttpClient) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(ledgerHttpClient);
        requestFactory.setReadTimeout(Duration.ofSeconds(10));

        return builder.clone()
                .baseUrl(relayerProperties.getSigner().getUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }
}
