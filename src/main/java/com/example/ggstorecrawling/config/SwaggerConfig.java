package com.example.ggstorecrawling.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger (SpringDoc OpenAPI) 설정 클래스
 *
 * 접속 URL: http://localhost:8080/swagger-ui.html
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .components(new Components())
                .info(apiInfo());
    }

    private Info apiInfo() {
        return new Info()
                .title("ggstore crawling API")
                .description("GGStore 상품 이미지 크롤러 API 명세서입니다. 크롤링 작업 실행, 장부(체크리스트) 현황, 미해결 오류 조회를 제공합니다.")
                .version("1.0.0");
    }
}
