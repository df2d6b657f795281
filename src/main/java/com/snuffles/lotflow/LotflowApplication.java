package com.snuffles.lotflow;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Arrays;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LotflowApplication {

    public static void main(String[] args) {
        // file runs exit when done and never start the web server
        boolean fileRun = Arrays.stream(args).anyMatch(arg -> arg.startsWith("--input="));
        new SpringApplicationBuilder(LotflowApplication.class)
            .web(fileRun ? WebApplicationType.NONE : WebApplicationType.SERVLET)
            .run(args);
    }
}
