package com.chs.calculator;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    @GetMapping("/api/health") // 로드밸런서나 프론트엔드가 서버 상태를 확인하는 주소입니다.
    public Map<String, String> health() {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("status", "healthy");
        data.put("message", "Calculator API is running");
        return data;
    }
}
