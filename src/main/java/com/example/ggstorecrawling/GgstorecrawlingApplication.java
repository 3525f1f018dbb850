package com.example.ggstorecrawling;

import com.example.ggstorecrawling.runner.CrawlCommandRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GGStore 크롤링 시스템의 메인 애플리케이션 클래스
 *
 * - 인자 없이 실행: REST API 서버 (Swagger UI: /swagger-ui.html)
 * - crawl / status / errors 명령으로 실행: 웹 서버 없이 명령만 수행하고 종료 코드를 반환
 */
@SpringBootApplication
public class GgstorecrawlingApplication {

	/**
	 * 애플리케이션 실행 진입점
	 *
	 * @param args 커맨드 라인 인자
	 */
	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(GgstorecrawlingApplication.class);
		if (CrawlCommandRunner.isCommand(args)) {
			application.setWebApplicationType(WebApplicationType.NONE);
			application.setBannerMode(Banner.Mode.OFF);
			System.exit(SpringApplication.exit(application.run(args)));
		}
		application.run(args);
	}
}
