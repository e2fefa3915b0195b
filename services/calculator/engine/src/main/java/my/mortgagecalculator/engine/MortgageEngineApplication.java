package my.mortgagecalculator.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MortgageEngineApplication {
	public static void main(String[] args) {
		SpringApplication.run(MortgageEngineApplication.class, args);
	}
}
