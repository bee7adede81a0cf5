package com.example.sheetstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetStreamApplication {

	public static void main(String[] args) {
		SpringApplication.run(SheetStreamApplication.class, args);
	}

}
