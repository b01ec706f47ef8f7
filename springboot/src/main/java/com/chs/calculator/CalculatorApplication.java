package com.chs.calculator;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalculatorApplication {

    public static void main(String[] args) {
        String currentDir = System.getProperty("user.dir");

        // 실행 위치가 root(home)인지 프로젝트 폴더(springboot)인지에 따라 경로 자동 선택
        loadDotenv(currentDir.endsWith("springboot") ? "./" : "./springboot");

        SpringApplication.run(CalculatorApplication.class, args);
    }

    static void loadDotenv(String directory) {
        Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .ignoreIfMalformed()
                .ignoreIfMissing()
                .load();

        // 이미 -D 로 지정된 값은 덮어쓰지 않음
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
            if (System.getProperty(entry.getKey()) == null) {
                System.setProperty(entry.getKey(), entry.getValue());
            }
        });
    }
}
