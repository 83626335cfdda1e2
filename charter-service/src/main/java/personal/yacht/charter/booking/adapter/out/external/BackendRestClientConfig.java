package personal.yacht.charter.booking.adapter.out.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reservation Backend RestClient Configuration
 *
 * Timeout 전략:
 * - Connect Timeout: TCP 연결 실패 빠른 감지
 * - Read Timeout: Circuit Breaker Slow Call 기준과 일치
 *
 * 백엔드 호출은 전용 스레드 풀에서 실행되어 호출자에게 CompletableFuture로 반환된다.
 */
@Configuration
public class BackendRestClientConfig {

    @Value("${backend.base-url}")
    private String backendBaseUrl;

    @Value("${backend.connect-timeout-ms:500}")
    private int connectTimeoutMs;

    @Value("${backend.read-timeout-ms:3000}")
    private int readTimeoutMs;

    @Value("${backend.call-pool-size:4}")
    private int callPoolSize;

    @Bean
    public RestClient backendRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .baseUrl(backendBaseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService backendCallExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(callPoolSize, runnable -> {
            Thread thread = new Thread(runnable, "backend-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
