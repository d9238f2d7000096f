package tore.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventRelayApplication.class, args);
    }
}
