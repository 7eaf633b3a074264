package github.sarthakdev143.ad_autopilot.integration.youtube;

import com.google.api.client.auth.oauth2.AuthorizationCodeResponseUrl;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.auth.oauth2.GoogleTokenResponse;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.youtube.YouTube;
import com.google.api.services.youtube.YouTubeScopes;
import com.sun.net.httpserver.HttpServer;
import github.sarthakdev143.ad_autopilot.config.AdAutopilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Builds an authorised YouTube client from an installed-app OAuth client secret. The first run waits for the
 * operator to grant access through a local callback; later runs reuse the stored refresh token.
 */
public class YouTubeServiceFactory {

    private static final Logger logger = LoggerFactory.getLogger(YouTubeServiceFactory.class);

    private static final int OAUTH_CALLBACK_PORT = 8888;
    private static final String OAUTH_CALLBACK_PATH = "/oauth2callback";
    private static final String OAUTH_USER_ID = "autopilot";
    private static final String OAUTH_CALLBACK_URI = "http://localhost:" + OAUTH_CALLBACK_PORT + OAUTH_CALLBACK_PATH;
    private static final long AUTHORIZATION_TIMEOUT_MINUTES = 3;
    static final List<String> SCOPES = List.of(YouTubeScopes.YOUTUBE_UPLOAD, YouTubeScopes.YOUTUBE_READONLY);

    private final Path credentialsPath;
    private final Path tokensDirectory;
    private final String applicationName;

    public YouTubeServiceFactory(AdAutopilotProperties.Youtube youtube) {
        this.credentialsPath = Path.of(youtube.getCredentialsPath());
        this.tokensDirectory = Path.of(youtube.getTokensDirectory());
        this.applicationName = youtube.getApplicationName();
    }

    public YouTube createService() throws GeneralSecurityException, IOException {
        requireCredentialsFile();
        HttpTransport httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        JsonFactory jsonFactory = GsonFactory.getDefaultInstance();
        Credential credential = authorize(httpTransport, jsonFactory);

        return new YouTube.Builder(httpTransport, jsonFactory, credential)
                .setApplicationName(applicationName)
                .build();
    }

    private Credential authorize(HttpTransport httpTransport, JsonFactory jsonFactory) throws IOException {
        GoogleClientSecrets clientSecrets;
        try (InputStream credentialsStream = Files.newInputStream(credentialsPath);
             InputStreamReader reader = new InputStreamReader(credentialsStream, StandardCharsets.UTF_8)) {
            clientSecrets = GoogleClientSecrets.load(jsonFactory, reader);
        }

        if (clientSecrets.getDetails() == null
                || clientSecrets.getDetails().getClientId() == null
                || clientSecrets.getDetails().getClientSecret() == null) {
            throw new IOException(
                    "Invalid OAuth client secret at " + credentialsPath.toAbsolutePath()
                            + ". Expected a file with a top-level 'installed' or 'web' section.");
        }

        Files.createDirectories(tokensDirectory);
        GoogleAuthorizationCodeFlow flow = new GoogleAuthorizationCodeFlow.Builder(
                httpTransport,
                jsonFactory,
                clientSecrets,
                SCOPES)
                .setDataStoreFactory(new FileDataStoreFactory(tokensDirectory.toFile()))
                .setAccessType("offline")
                .build();

        Credential stored = flow.loadCredential(OAUTH_USER_ID);
        if (stored != null) {
            return stored;
        }

        String authorizationUrl = flow.newAuthorizationUrl()
                .setRedirectUri(OAUTH_CALLBACK_URI)
                .build();
        String authorizationCode = awaitAuthorizationCode(authorizationUrl);
        GoogleTokenResponse tokenResponse = flow.newTokenRequest(authorizationCode)
                .setRedirectUri(OAUTH_CALLBACK_URI)
                .execute();
        logger.info("Stored new YouTube credentials in {}", tokensDirectory.toAbsolutePath());
        return flow.createAndStoreCredential(tokenResponse, OAUTH_USER_ID);
    }

    private String awaitAuthorizationCode(String authorizationUrl) throws IOException {
        CompletableFuture<String> codeFuture = new CompletableFuture<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("localhost", OAUTH_CALLBACK_PORT), 0);

        server.createContext(OAUTH_CALLBACK_PATH, exchange -> {
            AuthorizationCodeResponseUrl responseUrl = new AuthorizationCodeResponseUrl(
                    OAUTH_CALLBACK_URI + "?" + exchange.getRequestURI().getRawQuery());

            String responseBody;
            if (responseUrl.getError() != null) {
                codeFuture.completeExceptionally(new IOException("Authorization failed: " + responseUrl.getError()));
                responseBody = "Authorization failed. You can close this window.";
            } else if (responseUrl.getCode() != null) {
                codeFuture.complete(responseUrl.getCode());
                responseBody = "Authorization successful. You can close this window.";
            } else {
                codeFuture.completeExceptionally(new IOException("Authorization code missing from callback."));
                responseBody = "Authorization code missing. You can close this window.";
            }

            byte[] bodyBytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
            exchange.sendResponseHeaders(200, bodyBytes.length);
            try (OutputStream outputStream = exchange.getResponseBody()) {
                outputStream.write(bodyBytes);
            }
        });

        server.start();
        logger.warn("YouTube access has not been granted yet. Open this URL to authorize publishing: {}", authorizationUrl);
        try {
            return codeFuture.get(AUTHORIZATION_TIMEOUT_MINUTES, TimeUnit.MINUTES);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for YouTube authorization", e);
        } catch (Exception e) {
            if (e.getCause() instanceof IOException ioException) {
                throw ioException;
            }
            throw new IOException("YouTube authorization did not complete within "
                    + AUTHORIZATION_TIMEOUT_MINUTES + " minutes: " + authorizationUrl, e);
        } finally {
            server.stop(0);
        }
    }

    private void requireCredentialsFile() throws FileNotFoundException {
        if (!Files.isRegularFile(credentialsPath)) {
            throw new FileNotFoundException(
                    "YouTube OAuth client secret not found at " + credentialsPath.toAbsolutePath()
                            + ". Set YOUTUBE_CREDENTIALS_PATH or ad-autopilot.youtube.credentials-path.");
        }
    }
}
