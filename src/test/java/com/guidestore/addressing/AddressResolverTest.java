package com.guidestore.addressing;

import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressResolverTest {

    private final AddressResolver resolver = new AddressResolver();

    @Test
    void resolvesDocumentAndFragment() {
        Address address = resolver.resolve("api/auth.md#JWT");
        assertEquals("/api/auth.md", address.getDocumentPath());
        assertEquals("jwt", address.getSectionSlug());
        assertEquals(Namespace.DOCS, address.getNamespace());
        assertEquals("/api/auth.md#jwt", address.toString());
    }

    @Test
    void normalizesSeparators() {
        assertEquals("/api/auth.md", resolver.resolve("\\api//auth.md").getDocumentPath());
    }

    @Test
    void detectsNamespaces() {
        assertEquals(Namespace.COORDINATOR, resolver.resolve("/coordinator/active.md").getNamespace());
        assertEquals(Namespace.ARCHIVED, resolver.resolve("/archived/docs/a.md").getNamespace());
        assertEquals(Namespace.DOCS, resolver.resolve("/coordinatorish.md").getNamespace());
    }

    @Test
    void userPathDropsCoordinatorPrefixOnly() {
        assertEquals("/active.md", AddressResolver.toUserPath("/coordinator/active.md"));
        assertEquals("/archived/coordinator/2026-10-16T09-30-00.md",
            AddressResolver.toUserPath("/archived/coordinator/2026-10-16T09-30-00.md"));
        assertEquals("/api/auth.md", AddressResolver.toUserPath("/api/auth.md"));
        assertNull(AddressResolver.toUserPath(null));
    }

    @Test
    void rejectsTraversal() {
        AddressingException e = assertThrows(AddressingException.class, () -> resolver.resolve("/../secret.md"));
        assertEquals(ErrorCode.INVALID_PATH, e.getCode());
    }

    @Test
    void rejectsMissingExtension() {
        AddressingException e = assertThrows(AddressingException.class, () -> resolver.resolve("/notes.txt"));
        assertEquals(ErrorCode.INVALID_PATH, e.getCode());
    }

    @Test
    void rejectsEmptyFragment() {
        AddressingException e = assertThrows(AddressingException.class, () -> resolver.resolve("/doc.md#"));
        assertEquals(ErrorCode.INVALID_PATH, e.getCode());
    }

    @Test
    void coordinatorPathsRejectFragments() {
        AddressingException e = assertThrows(AddressingException.class,
            () -> resolver.resolve("/coordinator/active.md#first"));
        assertEquals(ErrorCode.NAMESPACE_VIOLATION, e.getCode());
    }

    @Test
    void resolvesSectionReferencesRelativeToDocument() {
        Address doc = resolver.resolve("/guide.md");
        assertEquals("setup", resolver.resolveSection("#Setup", doc).getSectionSlug());
        assertEquals("setup/linux", resolver.resolveSection("setup/linux", doc).getSectionSlug());
        assertEquals("usage", resolver.resolveSection("/guide.md#usage", doc).getSectionSlug());
    }

    @Test
    void sectionReferenceToAnotherDocumentIsRejected() {
        Address doc = resolver.resolve("/guide.md");
        AddressingException e = assertThrows(AddressingException.class,
            () -> resolver.resolveSection("/other.md#usage", doc));
        assertEquals(ErrorCode.INVALID_PARAMETER, e.getCode());
    }

    @Test
    void bareSlugWorksForCoordinatorDocuments() {
        Address doc = resolver.resolve("/coordinator/active.md");
        assertEquals("tasks", resolver.resolveSection("tasks", doc).getSectionSlug());
    }

    @Test
    void requireFragmentNeedsSlug() {
        AddressingException e = assertThrows(AddressingException.class,
            () -> resolver.requireFragment(resolver.resolve("/plan.md")));
        assertEquals(ErrorCode.MISSING_PARAMETER, e.getCode());
    }

    @Test
    void resolvesFolders() {
        assertEquals("/api", resolver.resolveFolder("api/"));
        assertThrows(AddressingException.class, () -> resolver.resolveFolder("/"));
    }
}
