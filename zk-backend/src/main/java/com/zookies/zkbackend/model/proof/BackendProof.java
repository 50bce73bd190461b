package com.zookies.zkbackend.model.proof;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackendProof {

    // Groth16 proof object: pi_a, pi_b, pi_c, protocol, curve
    private JsonNode proof;
    private List<String> publicSignals;

}
