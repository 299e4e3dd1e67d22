package org.stackup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StackupServerApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(StackupServerApplication.class, args);
    }

    /**
     * 提前创建日志目录（RollingFileAppender 在目录不存在时初始化失败；stdout 留给 MCP stdio 传输）。
     * <p>
     * 与 logback-spring.xml 一致：优先系统属性/环境变量 LOG_PATH，默认 ./logs
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            // stdout 被 MCP 协议占用，只能写 stderr
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
