package com.example.omnichat.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketConfig;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@org.springframework.context.annotation.Configuration
@ConditionalOnProperty(prefix = "omnichat.socketio", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(
            @Value("${omnichat.socketio.host:0.0.0.0}") String host,
            @Value("${omnichat.socketio.port:9094}") int port,
            @Value("${omnichat.socketio.ping-interval:25000}") int pingInterval,
            @Value("${omnichat.socketio.ping-timeout:60000}") int pingTimeout,
            ObjectMapper objectMapper) {
        Configuration configuration = new Configuration();
        configuration.setHostname(host);
        configuration.setPort(port);
        configuration.setAllowCustomRequests(true);
        configuration.setOrigin("*");
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setPingInterval(pingInterval);
        configuration.setPingTimeout(pingTimeout);
        configuration.setJsonSupport(new SpringJacksonJsonSupport(objectMapper));

        SocketConfig socketConfig = new SocketConfig();
        socketConfig.setReuseAddress(true);
        configuration.setSocketConfig(socketConfig);

        server = new SocketIOServer(configuration);
        server.start();
        return server;
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
        }
    }
}
