package com.stratum.core.llm;

import com.stratum.core.port.TransformationPort;
import org.springframework.stereotype.Component;

/**
 * {@link TransformationPort} backed by {@link LlmService} text calls.
 */
@Component
public class LlmTransformationPort implements TransformationPort {

    static final String SKELETON_SYSTEM = """
            Convert the given code skeleton to the target language. Lines of the form \
            "<number>: ...code..." stand for nested blocks: copy each of them unchanged onto \
            its own line at the place the block belongs. Return only code.""";

    static final String FRAGMENT_SYSTEM = """
            Convert the given code fragment to the target language. It will be inserted into \
            the provided parent skeleton. Return only code, without line numbers.""";

    private final LlmService llmService;

    public LlmTransformationPort(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String transformSkeleton(String placeholderCode, String locale) {
        return llmService.textCall(SKELETON_SYSTEM, "Comment language: " + locale + "\n\n" + placeholderCode);
    }

    @Override
    public String transformFragment(String code, String parentSkeleton, String locale) {
        String user = "Comment language: " + locale
                + (parentSkeleton == null || parentSkeleton.isBlank() ? "" : "\n\nParent skeleton:\n" + parentSkeleton)
                + "\n\nFragment:\n" + code;
        return llmService.textCall(FRAGMENT_SYSTEM, user);
    }
}
