package com.afsun.transpiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SQL方言转换应用主类
 *
 * @author afsun
 */
@SpringBootApplication(scanBasePackages = "com.afsun.transpiler")
@ConfigurationPropertiesScan
public class SqlTranspilerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SqlTranspilerApplication.class, args);
    }
}
