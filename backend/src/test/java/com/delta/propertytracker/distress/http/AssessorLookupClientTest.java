package com.delta.propertytracker.distress.http;

import com.delta.propertytracker.config.TrackerProperties;
import com.delta.propertytracker.distress.model.LookupFailure;
import com.delta.propertytracker.distress.model.ParcelLookupResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssessorLookupClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private TrackerProperties properties;
    private AssessorLookupClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new TrackerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        properties.getResolver().setLookupTimeoutSeconds(5);
        properties.getResolver().setLookupUrlTemplate(server.url("/parcel/").toString() + "{apn}");
        client = new AssessorLookupClient(properties, new PoliteHttpClient(properties, executor));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void lookupUrlUsesParcelDigits() {
        assertThat(client.lookupUrl("12-3456-78")).endsWith("/parcel/12345678");
        assertThat(client.lookupUrl("12-3456-78")).isEqualTo(client.lookupUrl(" 12 3456 78 "));
        assertThat(client.lookupUrl("none")).isNull();
    }

    @Test
    void returnsBodyOnSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<td>Location</td><td>100 Main St</td>"));

        ParcelLookupResult result = client.lookup("16-0241-11");

        assertThat(result.isOk()).isTrue();
        assertThat(result.body()).contains("100 Main St");
        assertThat(result.lookupUrl()).endsWith("/parcel/16024111");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/parcel/16024111");
    }

    @Test
    void mapsHttpErrorAndEmptyBody() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("   "));

        ParcelLookupResult notFound = client.lookup("16-0241-11");
        ParcelLookupResult empty = client.lookup("16-0241-11");

        assertThat(notFound.failure()).isEqualTo(LookupFailure.HTTP_STATUS);
        assertThat(notFound.detail()).isEqualTo("http_404");
        assertThat(notFound.lookupUrl()).isNotNull();
        assertThat(empty.failure()).isEqualTo(LookupFailure.EMPTY_BODY);
    }

    @Test
    void parcelWithoutDigitsNeverHitsTheNetwork() {
        ParcelLookupResult result = client.lookup("n/a");

        assertThat(result.failure()).isEqualTo(LookupFailure.INVALID_PARCEL);
        assertThat(result.lookupUrl()).isNull();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void connectionFailureIsAnIoError() {
        properties.getResolver().setLookupUrlTemplate("http://127.0.0.1:1/parcel/{apn}");

        ParcelLookupResult result = client.lookup("16-0241-11");

        assertThat(result.isOk()).isFalse();
        assertThat(result.failure()).isIn(LookupFailure.IO_ERROR, LookupFailure.TIMEOUT);
        assertThat(result.lookupUrl()).isEqualTo("http://127.0.0.1:1/parcel/16024111");
    }

    @Test
    void templateWithoutPlaceholderIsRejected() {
        properties.getResolver().setLookupUrlTemplate("https://assessor.example/search");
        assertThatThrownBy(() -> client.lookupUrl("16-0241-11"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("{apn}");
    }
}
