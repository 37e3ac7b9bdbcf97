package com.loadspec.service.api;

import com.loadspec.model.parse.SemanticIssue;
import com.loadspec.model.spec.LoadTestSpec;
import java.util.List;

public interface SemanticValidator {

    /**
     * Reviews a spec for suspicious but legal content. Never modifies the spec.
     *
     * @param spec A spec that already passed structural validation.
     * @return Issues in rule order, empty when nothing stands out.
     */
    List<SemanticIssue> review(LoadTestSpec spec);
}
