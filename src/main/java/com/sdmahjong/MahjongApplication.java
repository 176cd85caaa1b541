package com.sdmahjong;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 山东麻将（带财神）规则引擎主入口
 */
@SpringBootApplication
public class MahjongApplication {
    public static void main(String[] args) {
        SpringApplication.run(MahjongApplication.class, args);
    }
}
