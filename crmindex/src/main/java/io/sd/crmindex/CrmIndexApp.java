package io.sd.crmindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrmIndexApp {
	public static void main(String[] args) {
		SpringApplication.run(CrmIndexApp.class, args);
	}
}
