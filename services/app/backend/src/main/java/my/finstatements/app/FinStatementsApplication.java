package my.finstatements.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FinStatementsApplication {
	public static void main(String[] args) {
		SpringApplication.run(FinStatementsApplication.class, args);
	}
}
