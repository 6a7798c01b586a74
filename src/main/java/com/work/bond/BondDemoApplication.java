package com.work.bond;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口体验债券柜台的报价、存款与领取。
 */
@SpringBootApplication
public class BondDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(BondDemoApplication.class, args);
    }
}
