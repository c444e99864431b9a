package com.aris;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 编排引擎启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到所有子模块中的组件与 MyBatis Mapper。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
