package org.hotcold.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "enclave.signer.mnemonic=",
        "enclave.signer.dev-private-key=0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80",
        "enclave.seal-key=0f0e0d0c0b0a09080706050403020100f0e0d0c0b0a090807060504030201000"
})
class RoundApiIntegrationTest {

    private static final String SIGNER = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";
    private static final String PLAYER = "0x70997970C51812dc3A010C7d01b50e0d17dc79C8";
    private static final String TX = "0x" + "cd".repeat(32);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String roundId;

    @BeforeEach
    void startRound() throws Exception {
        MvcResult res = mockMvc.perform(post("/round/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"baseBuyIn\":\"1000\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.commitmentHash", matchesPattern("^0x[0-9a-f]{64}$")))
                .andExpect(jsonPath("$.baseBuyIn").value("1000"))
                .andExpect(jsonPath("$.signedStartRound.signature", matchesPattern("^0x[0-9a-f]{130}$")))
                .andReturn();

        Map<String, Object> body = objectMapper.readValue(res.getResponse().getContentAsString(),
                new TypeReference<Map<String, Object>>() {});
        roundId = (String) body.get("roundId");
    }

    private String guessBody(String guess, String paid) {
        return "{\"roundId\":\"" + roundId + "\",\"guess\":\"" + guess + "\",\"player\":\"" + PLAYER
                + "\",\"txHash\":\"" + TX + "\"" + (paid == null ? "" : ",\"buyInPaid\":\"" + paid + "\"") + "}";
    }

    @Test
    void attestation_shouldExposeSimulationSigner() throws Exception {
        mockMvc.perform(get("/attestation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address").value(SIGNER))
                .andExpect(jsonPath("$.mode").value("simulation"))
                .andExpect(jsonPath("$.publicKey", startsWith("0x04")));
    }

    @Test
    void startedRound_shouldBeActiveAtBaseTier() throws Exception {
        mockMvc.perform(get("/round/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roundId").value(roundId));

        mockMvc.perform(get("/round/{id}/status", roundId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.priceTier").value("base"))
                .andExpect(jsonPath("$.currentBuyIn").value("1000"))
                .andExpect(jsonPath("$.pool").value("0"))
                .andExpect(jsonPath("$.guessCount").value(0))
                .andExpect(jsonPath("$.winner").doesNotExist());
    }

    @Test
    void guess_shouldReturnSignedHintAndExtendAuditTrail() throws Exception {
        mockMvc.perform(post("/guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(guessBody("000000000000", null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hint.digitsInPlace", allOf(greaterThanOrEqualTo(0), lessThanOrEqualTo(12))))
                .andExpect(jsonPath("$.hint.numericDistance", matchesPattern("^\\d+$")))
                .andExpect(jsonPath("$.signedHint.player").value(PLAYER))
                .andExpect(jsonPath("$.signedHint.signature", matchesPattern("^0x[0-9a-f]{130}$")));

        mockMvc.perform(get("/round/{id}/status", roundId))
                .andExpect(jsonPath("$.guessCount").value(1))
                .andExpect(jsonPath("$.pool").value("1000"));

        mockMvc.perform(get("/round/{id}/audit", roundId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries[0].type").value("ROUND_START"))
                .andExpect(jsonPath("$.entries[0].previousHash").value("0x" + "0".repeat(64)))
                .andExpect(jsonPath("$.entries[1].type").value("GUESS"))
                .andExpect(jsonPath("$.entries[2].type").value("HINT"))
                .andExpect(jsonPath("$.merkleRoot", matchesPattern("^0x[0-9a-f]{64}$")))
                .andExpect(jsonPath("$.signedMerkleRoot.entryCount").value(greaterThanOrEqualTo(3)));

        mockMvc.perform(get("/round/{id}/verify", roundId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chainValid").value(true));
    }

    @Test
    void guess_underpaid_shouldReturn402() throws Exception {
        mockMvc.perform(post("/guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(guessBody("000000000000", "999")))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PAYMENT"));
    }

    @Test
    void guess_malformed_shouldReturn400WithFieldDetails() throws Exception {
        mockMvc.perform(post("/guess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(guessBody("12ab", null)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.guess").exists());
    }

    @Test
    void unknownRound_shouldReturn404() throws Exception {
        mockMvc.perform(get("/round/{id}/status", "does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        MvcResult res = mockMvc.perform(get("/round/{id}/audit", "does-not-exist"))
                .andExpect(status().isNotFound())
                .andReturn();
        assertThat(res.getResponse().getContentAsString()).contains("does-not-exist");
    }
}
