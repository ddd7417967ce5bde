package com.abba.ainay.infrastructure.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "ainay.push", name = "credentials-path")
public class FirebaseConfig {

    @Bean
    public FirebaseApp firebaseApp(PushProperties properties) throws IOException {
        for (FirebaseApp app : FirebaseApp.getApps()) {
            if (app.getName().equals(properties.getAppName())) {
                return app;
            }
        }
        try (InputStream serviceAccount = new FileInputStream(properties.getCredentialsPath())) {
            FirebaseOptions options = FirebaseOptions.builder()
                    .setCredentials(GoogleCredentials.fromStream(serviceAccount))
                    .setConnectTimeout((int) properties.getConnectTimeout().toMillis())
                    .setReadTimeout((int) properties.getReadTimeout().toMillis())
                    .build();
            FirebaseApp app = FirebaseApp.initializeApp(options, properties.getAppName());
            log.info("Firebase initialized for push notifications");
            return app;
        }
    }

    @Bean
    public FirebaseMessaging firebaseMessaging(FirebaseApp firebaseApp) {
        return FirebaseMessaging.getInstance(firebaseApp);
    }
}
