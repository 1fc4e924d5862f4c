package com.cgi.dataprofiler.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan(basePackages = {"com.cgi.dataprofiler.engine", "com.cgi.dataprofiler.detector"})
public class DataProfilerApplication {

	public static void main(String[] args) {
		SpringApplication.run(DataProfilerApplication.class, args);
	}

}
