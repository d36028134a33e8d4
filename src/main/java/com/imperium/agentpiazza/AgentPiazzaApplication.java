package com.imperium.agentpiazza;

import com.imperium.agentpiazza.config.DotenvLoader;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("com.imperium.agentpiazza.mapper")
public class AgentPiazzaApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // .env -> 系统属性，供 application.yaml 占位符解析
        SpringApplication.run(AgentPiazzaApplication.class, args);
    }
}
