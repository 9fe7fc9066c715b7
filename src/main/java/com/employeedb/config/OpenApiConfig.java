package com.employeedb.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI employeeDbOpenAPI(@Value("${server.port:8000}") int port) {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:" + port);
        localServer.setDescription("Local Development Server");

        Contact contact = new Contact();
        contact.setName("Employee DB Team");

        Info info = new Info()
                .title("Employee DB Service API")
                .version("1.0.0")
                .description("Health check and employee records backed by PostgreSQL")
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
