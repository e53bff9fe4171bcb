package com.project.image.enhancement;

import com.project.image.enhancement.cli.EnhanceArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point. With command-line flags such as {@code --input photo.jpg} the application runs
 * once without a web server and exits with the command's status; otherwise it serves HTTP.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Application.class);
        if (EnhanceArguments.isCommandLineInvocation(args)) {
            app.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(app.run(args)));
        }
        app.run(args);
    }
}
