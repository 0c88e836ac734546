package app.mstudio.render.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClientCustomizer renderTimeoutsCustomizer(HttpClientProps props) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(props.connectTimeout());
            factory.setReadTimeout(props.readTimeout());
            builder.requestFactory(factory);
        };
    }
}
