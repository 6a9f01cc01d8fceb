package io.carelink.a2a.client.http.jdk;

import io.carelink.a2a.client.http.HttpClient;
import io.carelink.a2a.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url);
    }
}
