package com.smurthy.ai.insights;

import com.smurthy.ai.insights.config.RpcProperties;
import com.smurthy.ai.insights.config.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({SessionProperties.class, RpcProperties.class})
public class SearchInsightsApplication {

	public static void main(String[] args) {
		SpringApplication.run(SearchInsightsApplication.class, args);
	}

}
