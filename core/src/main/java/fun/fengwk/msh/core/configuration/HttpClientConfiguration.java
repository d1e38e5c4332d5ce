package fun.fengwk.msh.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * @author fengwk
 */
@Configuration
public class HttpClientConfiguration {

    @Bean(name = "searchHttpClient")
    public HttpClient searchHttpClient() {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(15))
            .build();
    }

}
