package se.fishmarket_be.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import se.fishmarket_be.configuration.CorsConfig;
import se.fishmarket_be.configuration.JWTTokenUtil;
import se.fishmarket_be.configuration.JacksonConfig;
import se.fishmarket_be.configuration.SecurityConfig;
import se.fishmarket_be.dto.request.PaymentCreateRequest;
import se.fishmarket_be.dto.response.PaymentResponse;
import se.fishmarket_be.exception.InvalidTokenException;
import se.fishmarket_be.pojo.User;
import se.fishmarket_be.pojo.enums.PaymentStatus;
import se.fishmarket_be.pojo.enums.PaymentType;
import se.fishmarket_be.service.CustomUserDetailsService;
import se.fishmarket_be.service.PaymentService;
import se.fishmarket_be.service.UserService;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PaymentController.class)
@Import({SecurityConfig.class, CorsConfig.class, JacksonConfig.class, JWTTokenUtil.class})
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PaymentService paymentService;

    @MockBean
    private UserService userService;

    @MockBean
    private CustomUserDetailsService customUserDetailsService;

    @Test
    @DisplayName("POST /api/payments/callback: snake_case notification is accepted without a login")
    void callback_SnakeCase() throws Exception {
        // Given
        String body = "{\"transaction_id\":\"FM-1\",\"transaction_status\":\"settlement\",\"gross_amount\":\"50.00\"}";
        when(paymentService.handleGatewayCallback("FM-1", "settlement", body)).thenReturn(true);

        // When / Then
        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));

        verify(paymentService).verifyCallbackToken(null);
        verify(paymentService).handleGatewayCallback("FM-1", "settlement", body);
    }

    @Test
    @DisplayName("POST /api/payments/callback: order_id is the payment reference and the body is passed on untouched")
    void callback_OrderIdWithGatewayTransactionId() throws Exception {
        // Given
        String body = "{\"transaction_id\":\"57d5293c-gw\",\"transaction_status\":\"settlement\","
                + "\"order_id\":\"FM-123\",\"gross_amount\":\"50.00\"}";
        when(paymentService.handleGatewayCallback(eq("FM-123"), eq("settlement"), anyString())).thenReturn(true);

        // When / Then
        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
        verify(paymentService).handleGatewayCallback(eq("FM-123"), eq("settlement"), stored.capture());
        assertThat(stored.getValue()).isEqualTo(body);
        assertThat(objectMapper.readTree(stored.getValue())).isEqualTo(objectMapper.readTree(body));
    }

    @Test
    @DisplayName("POST /api/payments/callback: wrong callback token is 401")
    void callback_BadToken() throws Exception {
        // Given
        doThrow(new InvalidTokenException("Invalid callback token"))
                .when(paymentService).verifyCallbackToken("forged");

        // When / Then
        mockMvc.perform(post("/api/payments/callback")
                        .header("X-Callback-Token", "forged")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\":\"FM-1\",\"transactionStatus\":\"settlement\"}"))
                .andExpect(status().isUnauthorized());

        verify(paymentService, never()).handleGatewayCallback(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("POST /api/payments/callback: missing transaction id is 400")
    void callback_MissingTransaction() throws Exception {
        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transaction_status\":\"settlement\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Transaction ID is required"));

        verify(paymentService, never()).handleGatewayCallback(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("POST /api/payments/callback: malformed body is 400")
    void callback_MalformedBody() throws Exception {
        mockMvc.perform(post("/api/payments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"order_id\":"))
                .andExpect(status().isBadRequest());

        verify(paymentService, never()).handleGatewayCallback(anyString(), anyString(), anyString());
    }

    @Test
    @WithMockUser(username = "buyer@fish.vn")
    @DisplayName("POST /api/payments: membership payment without membershipId is 400")
    void createPayment_MissingTarget() throws Exception {
        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"MEMBERSHIP\",\"amount\":149000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));

        verifyNoInteractions(paymentService);
    }

    @Test
    @WithMockUser(username = "buyer@fish.vn")
    @DisplayName("POST /api/payments: creates a pending payment for the caller")
    void createPayment_Created() throws Exception {
        // Given
        User buyer = User.builder().userId(8L).email("buyer@fish.vn").build();
        when(userService.findByEmail("buyer@fish.vn")).thenReturn(buyer);
        PaymentResponse pending = PaymentResponse.builder()
                .paymentId(1L)
                .userId(8L)
                .adId(100L)
                .type(PaymentType.BOOST)
                .amount(new BigDecimal("50.00"))
                .status(PaymentStatus.PENDING)
                .gatewayTransactionId("FM-xyz")
                .build();
        when(paymentService.createPayment(any(PaymentCreateRequest.class), eq(8L))).thenReturn(pending);

        // When / Then
        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"BOOST\",\"adId\":100,\"amount\":50}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andExpect(jsonPath("$.data.gatewayTransactionId").value("FM-xyz"));
    }

    @Test
    @WithMockUser(username = "buyer@fish.vn")
    @DisplayName("GET /api/payments: admin only")
    void getAllPayments_NotAdmin() throws Exception {
        mockMvc.perform(get("/api/payments"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(paymentService);
    }

    @Test
    @WithMockUser(username = "admin@fish.vn", roles = {"USER", "ADMIN"})
    @DisplayName("POST /api/payments/{id}/process: admin confirmation")
    void process_Admin() throws Exception {
        when(paymentService.processSuccessfulPayment(5L)).thenReturn(true);

        mockMvc.perform(post("/api/payments/5/process"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));
    }
}
