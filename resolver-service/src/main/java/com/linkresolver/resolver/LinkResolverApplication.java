package com.linkresolver.resolver;

import com.linkresolver.resolver.config.ResolverProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {"com.linkresolver.resolver", "com.linkresolver.common"})
@EnableConfigurationProperties(ResolverProperties.class)
public class LinkResolverApplication {
	
	public static void main(String[] args) {
		SpringApplication.run(LinkResolverApplication.class, args);
	}
}
