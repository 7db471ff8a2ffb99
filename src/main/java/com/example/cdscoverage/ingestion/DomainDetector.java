package com.example.cdscoverage.ingestion;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects the clinical domain of a guideline from its vocabulary.
 * Specialties are tried in declaration order; the first match wins.
 */
@Service
public class DomainDetector {

    public static final String GENERAL = "general";

    private static final Map<String, Pattern> SPECIALTY_PATTERNS = new LinkedHashMap<>();

    static {
        SPECIALTY_PATTERNS.put("cardiology",
                Pattern.compile("heart|cardiac|atrial|ventricular|coronary|afib|arrhythmia", Pattern.CASE_INSENSITIVE));
        SPECIALTY_PATTERNS.put("oncology",
                Pattern.compile("cancer|tumor|carcinoma|lymphoma|leukemia|metastasis|chemotherapy", Pattern.CASE_INSENSITIVE));
        SPECIALTY_PATTERNS.put("endocrinology",
                Pattern.compile("diabetes|thyroid|hormone|endocrine|insulin", Pattern.CASE_INSENSITIVE));
        SPECIALTY_PATTERNS.put("pulmonology",
                Pattern.compile("lung|pulmonary|respiratory|asthma|copd", Pattern.CASE_INSENSITIVE));
    }

    public String detect(String text) {
        if (text == null || text.isBlank()) return GENERAL;
        for (Map.Entry<String, Pattern> specialty : SPECIALTY_PATTERNS.entrySet()) {
            if (specialty.getValue().matcher(text).find()) {
                return specialty.getKey();
            }
        }
        return GENERAL;
    }
}
