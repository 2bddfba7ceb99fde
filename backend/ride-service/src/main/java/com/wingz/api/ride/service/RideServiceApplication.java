package com.wingz.api.ride.service;

import com.wingz.api.ride.service.config.WingzProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.wingz.api")
@EntityScan(basePackages = {"com.wingz.api.ride.service", "com.wingz.api.shared"})
@EnableJpaRepositories(basePackages = "com.wingz.api.ride.service")
@EnableConfigurationProperties(WingzProperties.class)
public class RideServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(RideServiceApplication.class, args);
	}
}
