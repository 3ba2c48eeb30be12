package com.tony.gameForecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameForecastApplication {

	public static void main(String[] args) {
		SpringApplication.run(GameForecastApplication.class, args);
	}

}
