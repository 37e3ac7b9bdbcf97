package com.loadspec.model.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A templated request body whose {@code {{name}}} placeholders are filled per request
 * by the listed variables.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PayloadSpec {

    private String template;

    private List<VariableDefinition> variables = new ArrayList<>();
}
