package io.markwise.core.normalize;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;

@FunctionalInterface
public interface AnswerDecoder {
    Optional<List<AnswerCandidate>> decode(ObjectNode document);
}
