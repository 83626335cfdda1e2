package personal.yacht.charter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Charter Service Application
 * 예약 충돌 엔진, 낙관적 상태 관리자, 오프라인 변경 대기열을 구동하는 서비스
 */
@EnableScheduling  // 네트워크 헬스 프로브 활성화
@ConfigurationPropertiesScan
@SpringBootApplication
public class CharterServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CharterServiceApplication.class, args);
    }
}
