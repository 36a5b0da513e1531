package com.phillippitts.modelorchestrator.service.invoker;

import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import com.phillippitts.modelorchestrator.domain.ErrorClass;
import com.phillippitts.modelorchestrator.domain.InvocationRequest;
import com.phillippitts.modelorchestrator.domain.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiChatModelInvokerTest {

    private static final String URL = "https://openai.test/v1/chat/completions";

    private MockRestServiceServer server;
    private OpenAiChatModelInvoker invoker;

    @BeforeEach
    void setUp() {
        ModelApiProperties api = new ModelApiProperties();
        api.getGpt4().setUrl(URL);
        api.getGpt4().setApiKey("sk-test");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        invoker = new OpenAiChatModelInvoker(api, builder);
    }

    private Outcome call() {
        return invoker.invoke(new InvocationRequest("gpt4", "Say hi", 5000));
    }

    @Test
    void extractsMessageContent() {
        server.expect(requestTo(URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("Say hi"))
                .andExpect(jsonPath("$.temperature").value(0.7))
                .andRespond(withSuccess("""
                        {"choices":[{"index":0,"message":{"role":"assistant","content":"Hi!"}}]}
                        """, MediaType.APPLICATION_JSON));

        assertThat(((Outcome.Success) call()).output()).isEqualTo("Hi!");
        server.verify();
    }

    @Test
    void badKeyIsAuthEvenWhenTypedAsInvalidRequest() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("""
                        {"error":{"message":"Incorrect API key provided","type":"invalid_request_error"}}
                        """));

        assertThat(((Outcome.Failure) call()).errorClass()).isEqualTo(ErrorClass.AUTH_ERROR);
    }

    @Test
    void contextLengthIsInvalidRequest() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("""
                        {"error":{"message":"maximum context length exceeded","type":"invalid_request_error"}}
                        """));

        assertThat(((Outcome.Failure) call()).errorClass()).isEqualTo(ErrorClass.INVALID_REQUEST_ERROR);
    }

    @Test
    void nullContentIsUnknown() {
        server.expect(requestTo(URL)).andRespond(withSuccess("""
                {"choices":[{"message":{"role":"assistant","content":null}}]}
                """, MediaType.APPLICATION_JSON));

        assertThat(((Outcome.Failure) call()).errorClass()).isEqualTo(ErrorClass.UNKNOWN_ERROR);
    }
}
