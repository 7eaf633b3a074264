package github.sarthakdev143.ad_autopilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdAutopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdAutopilotApplication.class, args);
    }

}
