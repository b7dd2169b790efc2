package com.ecaree.mappingconverter.manifest;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class LibraryExtractInstructions {
    private List<String> exclude = new ArrayList<>();

    public boolean isEmpty() {
        return exclude == null || exclude.isEmpty();
    }
}
