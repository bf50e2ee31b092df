package com.di.insightnova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The DataSource is built by {@link com.di.insightnova.config.PersistenceConfig} only when
 * {@code insightnova.persistence.jdbc-enabled=true}; otherwise every store runs in memory.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@EnableScheduling
@EnableAspectJAutoProxy(proxyTargetClass = false)
@ConfigurationPropertiesScan
public class InsightNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(InsightNovaApplication.class, args);
	}
}
