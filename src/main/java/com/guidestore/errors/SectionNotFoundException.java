package com.guidestore.errors;

import java.util.List;
import java.util.Map;

public class SectionNotFoundException extends AddressingException {

    public SectionNotFoundException(String slug, List<String> available) {
        super(ErrorCode.SECTION_NOT_FOUND, "Section not found: " + slug,
            Map.of("slug", slug, "available", List.copyOf(available)));
    }
}
