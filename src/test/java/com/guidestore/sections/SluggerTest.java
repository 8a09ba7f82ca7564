package com.guidestore.sections;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SluggerTest {

    @Test
    void slugifiesLikeGithub() {
        assertEquals("hello-world", Slugger.slugify("Hello World"));
        assertEquals("c--go", Slugger.slugify("C++ & Go!"));
        assertEquals("api_v2", Slugger.slugify("API_v2"));
    }

    @Test
    void suffixesRepeats() {
        Slugger slugger = new Slugger();
        assertEquals("notes", slugger.slug("Notes"));
        assertEquals("notes-1", slugger.slug("Notes"));
        assertEquals("notes-2", slugger.slug("notes"));
    }

    @Test
    void emptySlugFallsBack() {
        assertEquals("section", new Slugger().slug("!!!"));
    }

    @Test
    void resetForgetsIssuedSlugs() {
        Slugger slugger = new Slugger();
        slugger.slug("A");
        slugger.reset();
        assertEquals("a", slugger.slug("A"));
    }
}
