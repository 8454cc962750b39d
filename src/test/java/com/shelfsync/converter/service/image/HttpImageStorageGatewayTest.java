package com.shelfsync.converter.service.image;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class HttpImageStorageGatewayTest {
    private static final String BASE = "https://Storage.Example";

    private final List<ClientRequest> requests = new ArrayList<>();

    private HttpImageStorageGateway gateway(HttpStatus status) {
        WebClient client = WebClient.builder()
                .baseUrl(BASE)
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status).build());
                })
                .build();
        return new HttpImageStorageGateway(client, BASE, Duration.ofSeconds(2));
    }

    @Test
    public void acceptsOnlyStorageOriginAndAssetPaths() {
        HttpImageStorageGateway gateway = gateway(HttpStatus.OK);
        assertEquals(Optional.of("a.jpg"), gateway.imageName("https://storage.example/api/images/a.jpg"));
        assertEquals(Optional.of("b.png"), gateway.imageName("https://storage.example/images/b.png?w=100"));
        assertEquals(Optional.of("c.webp"), gateway.imageName("images/c.webp"));

        assertFalse(gateway.isManaged("https://cdn.other.example/api/images/a.jpg"));
        assertFalse(gateway.isManaged("http://storage.example/api/images/a.jpg"));
        assertFalse(gateway.isManaged("https://storage.example/static/a.jpg"));
        assertFalse(gateway.isManaged("https://storage.example/api/images/../secret"));
        assertFalse(gateway.isManaged("https://storage.example/api/images/dir/a.jpg"));
        assertFalse(gateway.isManaged("https://storage.example/api/images/"));
        assertFalse(gateway.isManaged(null));
    }

    @Test
    public void deleteCallsStorageApi() {
        gateway(HttpStatus.NO_CONTENT).delete("https://storage.example/images/a.jpg");
        assertEquals(1, requests.size());
        assertEquals(HttpMethod.DELETE, requests.get(0).method());
        assertEquals("/api/images/a.jpg", requests.get(0).url().getPath());
    }

    @Test
    public void missingAssetCountsAsDeleted() {
        assertDoesNotThrow(() -> gateway(HttpStatus.NOT_FOUND).delete("https://storage.example/api/images/a.jpg"));
    }

    @Test
    public void serverErrorBecomesDeleteException() {
        ImageDeleteException e = assertThrows(ImageDeleteException.class,
                () -> gateway(HttpStatus.INTERNAL_SERVER_ERROR).delete("https://storage.example/api/images/a.jpg"));
        assertEquals("https://storage.example/api/images/a.jpg", e.getUrl());
    }

    @Test
    public void timeoutBecomesDeleteException() {
        WebClient client = WebClient.builder()
                .baseUrl(BASE)
                .exchangeFunction(request -> Mono.never())
                .build();
        HttpImageStorageGateway gateway = new HttpImageStorageGateway(client, BASE, Duration.ofMillis(100));
        assertThrows(ImageDeleteException.class, () -> gateway.delete("https://storage.example/api/images/a.jpg"));
    }

    @Test
    public void unmanagedUrlIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> gateway(HttpStatus.OK).delete("https://cdn.other.example/api/images/a.jpg"));
        assertTrue(requests.isEmpty());
    }

    @Test
    public void baseUrlMustBeHttp() {
        assertThrows(IllegalArgumentException.class, () -> HttpImageStorageGateway.originOf("ftp://storage.example"));
        assertEquals("https://storage.example", HttpImageStorageGateway.originOf(" https://Storage.Example/ "));
    }
}
