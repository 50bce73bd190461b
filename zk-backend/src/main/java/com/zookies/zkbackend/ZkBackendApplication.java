package com.zookies.zkbackend;

import com.zookies.zkbackend.config.PublisherKeyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PublisherKeyProperties.class)
public class ZkBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ZkBackendApplication.class, args);
	}

}
