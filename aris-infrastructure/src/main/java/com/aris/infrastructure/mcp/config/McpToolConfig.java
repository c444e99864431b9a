package com.aris.infrastructure.mcp.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 启用工具服务配置绑定。
 */
@Configuration
@EnableConfigurationProperties(ToolServerProperties.class)
public class McpToolConfig {
}
