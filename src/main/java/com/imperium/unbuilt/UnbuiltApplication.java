package com.imperium.unbuilt;

import com.imperium.unbuilt.config.DotenvLoader;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@MapperScan("com.imperium.unbuilt.mapper")
public class UnbuiltApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // 加载 .env 到系统属性，供 application.yaml 中的 ${VAR} 使用
        SpringApplication.run(UnbuiltApplication.class, args);
    }
}
