package com.example.pdfcompress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the PDF compression service.
 * This class only wires the application context; the HTTP endpoints live under the interfaces layer.
 */
@SpringBootApplication
public class PdfCompressApplication {

	public static void main(String[] args) {
		System.setProperty("java.awt.headless", "true");
		SpringApplication.run(PdfCompressApplication.class, args);
	}

}
