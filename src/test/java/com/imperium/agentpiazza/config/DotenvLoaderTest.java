package com.imperium.agentpiazza.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DotenvLoaderTest {

    @Test
    void parsesKeyValuesSkippingCommentsAndQuotes() {
        Map<String, String> env = DotenvLoader.parse("""
                # database
                DB_URL=jdbc:postgresql://db:5432/agentpiazza
                export DB_USERNAME = "piazza"
                SCOPE_DESCRIPTION='AI agents'

                not a pair
                """);

        assertEquals("jdbc:postgresql://db:5432/agentpiazza", env.get("DB_URL"));
        assertEquals("piazza", env.get("DB_USERNAME"));
        assertEquals("AI agents", env.get("SCOPE_DESCRIPTION"));
        assertEquals(3, env.size());
    }

    @Test
    void openAiBaseUrlsLoseTrailingVersion() {
        Map<String, String> env = DotenvLoader.parse("OPENAI_BASE_URL=https://api.example.com/v1/\nOTHER_URL=https://x.test/v1");

        assertEquals("https://api.example.com", env.get("OPENAI_BASE_URL"));
        assertEquals("https://x.test/v1", env.get("OTHER_URL"));
    }
}
