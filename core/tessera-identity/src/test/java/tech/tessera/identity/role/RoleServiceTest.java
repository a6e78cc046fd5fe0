package tech.tessera.identity.role;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tessera.identity.authorization.ReservedResources;
import tech.tessera.identity.common.BulkDeleteResult;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.CumulativeValidationException;
import tech.tessera.identity.common.errors.ErrorKind;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.event.IdentityEventType;
import tech.tessera.identity.test.CoreFixture;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RoleService over an in-memory store.
 */
class RoleServiceTest {

    private CoreFixture core;
    private String membershipId;
    private Utilizer admin;

    @BeforeEach
    void setUp() {
        core = new CoreFixture();
        membershipId = core.membership("Acme").id();
        admin = Utilizer.human("usr_admin", "root", Role.ADMINISTRATOR, membershipId);
    }

    private Role create(String name, List<String> permissions, List<String> forbidden) {
        return core.roles.create(admin, membershipId, Role.builder()
            .name(name)
            .permissions(permissions)
            .forbidden(forbidden)
            .build());
    }

    private void storeDirectly(String slug) {
        core.store.collection(Role.COLLECTION).insert(DynamicDocument.parse(
            "{\"_id\":\"rol_" + slug + "\",\"membership_id\":\"" + membershipId + "\",\"name\":\"" + slug
                + "\",\"slug\":\"" + slug + "\",\"permissions\":[]}"));
    }

    // ========================================
    // CREATE TESTS
    // ========================================

    @Test
    @DisplayName("create should accept a carve-out and reject an identical allow and deny pattern")
    void create_shouldRejectConflictingPatterns_butAcceptCarveOut() {
        // Arrange & Act
        Role editor = create("Editor", List.of("blog.posts.*"), List.of("blog.posts.delete"));

        // Assert
        assertThat(editor.slug()).isEqualTo("editor");
        assertThat(editor.membershipId()).isEqualTo(membershipId);
        assertThatThrownBy(() -> create("Editor2", List.of("blog.posts.delete"), List.of("blog.posts.delete")))
            .isInstanceOfSatisfying(CumulativeValidationException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONFLICTING_PATTERNS));
    }

    @Test
    @DisplayName("create should require a name")
    void create_shouldRequireName() {
        assertThatThrownBy(() -> create(null, List.of(), List.of()))
            .isInstanceOfSatisfying(CumulativeValidationException.class,
                e -> assertThat(e.hasErrorFor("name")).isTrue());
    }

    @Test
    @DisplayName("create should reject a name without letters or digits instead of storing an empty slug")
    void create_shouldRejectName_whenSlugWouldBeEmpty() {
        assertThatThrownBy(() -> create("!!!", List.of(), List.of()))
            .isInstanceOfSatisfying(CumulativeValidationException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION_FAILED);
                assertThat(e.errors()).singleElement().satisfies(error -> {
                    assertThat(error.field()).isEqualTo("name");
                    assertThat(error.code()).isEqualTo("INVALID_NAME");
                });
            });
        assertThat(core.roles.list(membershipId, Paging.of(0, 10)).items()).isEmpty();
    }

    @Test
    @DisplayName("create should reject a name whose slug is already taken")
    void create_shouldRejectDuplicateSlug() {
        create("Editor", List.of(), List.of());

        assertThatThrownBy(() -> create("editor", List.of(), List.of()))
            .isInstanceOfSatisfying(CumulativeValidationException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.ALREADY_EXISTS);
                assertThat(e.hasErrorFor("slug")).isTrue();
            });
    }

    @Test
    @DisplayName("create should refuse a reserved name for a human utilizer")
    void create_shouldRefuseReservedName_forHuman() {
        assertThatThrownBy(() -> create("Server", List.of(), List.of()))
            .isInstanceOfSatisfying(IdentityException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.RESERVED_NAME_VIOLATION);
                assertThat(e.code()).isEqualTo("RESERVED_ROLE_NAME");
            });
    }

    @Test
    @DisplayName("create should refresh the cache so the new role is read back immediately")
    void create_shouldRefreshCache() {
        Role editor = create("Editor", List.of("blog.posts.*"), List.of());

        assertThat(core.roleCache.get(membershipId).orElseThrow()).containsExactly(editor);
        assertThat(core.roles.getBySlug(membershipId, "editor")).contains(editor);
        assertThat(core.events.ofType(IdentityEventType.ROLE_CREATED)).hasSize(1);
    }

    // ========================================
    // UPDATE TESTS
    // ========================================

    @Test
    @DisplayName("update should reject a payload that leaves the role unchanged")
    void update_shouldRejectIdenticalDocument() {
        Role editor = create("Editor", List.of("blog.posts.*"), List.of());

        assertThatThrownBy(() -> core.roles.update(admin, membershipId, editor.id(),
                Role.builder().name("Editor").permissions(List.of("blog.posts.*")).build()))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.IDENTICAL_DOCUMENT));
    }

    @Test
    @DisplayName("update should reject a slug change")
    void update_shouldRejectSlugChange() {
        Role editor = create("Editor", List.of(), List.of());

        assertThatThrownBy(() -> core.roles.update(admin, membershipId, editor.id(),
                Role.builder().slug("publisher").build()))
            .isInstanceOfSatisfying(IdentityException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.IMMUTABLE);
                assertThat(e.code()).isEqualTo("ROLE_SLUG_IMMUTABLE");
            });
    }

    @Test
    @DisplayName("update should keep omitted fields and refresh the cache")
    void update_shouldMergePartialChanges() {
        Role editor = create("Editor", List.of("blog.posts.*"), List.of());

        Role updated = core.roles.update(admin, membershipId, editor.id(),
            Role.builder().description("Writes posts").build());

        assertThat(updated.permissions()).containsExactly("blog.posts.*");
        assertThat(updated.description()).isEqualTo("Writes posts");
        assertThat(core.roles.getById(membershipId, editor.id())).contains(updated);
    }

    // ========================================
    // READ TESTS
    // ========================================

    @Test
    @DisplayName("getBySlug should always return the synthesized server role")
    void getBySlug_shouldSynthesizeServer_regardlessOfStore() {
        storeDirectly(Role.SERVER);

        Role server = core.roles.getBySlug(membershipId, Role.SERVER).orElseThrow();

        assertThat(server.id()).isEqualTo(Role.SERVER);
        assertThat(server.permissions()).containsExactlyElementsOf(ReservedRoles.SERVER_PERMISSIONS);
        assertThat(core.roles.getBySlug(membershipId, Role.SERVER)).get().isSameAs(server);
    }

    @Test
    @DisplayName("getBySlug should return the synthesized administrator even when one is stored")
    void getBySlug_shouldSynthesizeAdministrator() {
        core.roles.ensureAdministratorRole(membershipId);

        Role administrator = core.roles.getBySlug(membershipId, Role.ADMINISTRATOR).orElseThrow();

        assertThat(administrator.id()).isEqualTo(Role.ADMINISTRATOR);
        assertThat(administrator.permissions()).containsExactlyElementsOf(ReservedResources.adminPermissions());
    }

    @Test
    @DisplayName("a cache miss should read the store without populating the cache")
    void getBySlug_shouldNotPopulateCache_onStoreFallback() {
        storeDirectly("auditor");

        assertThat(core.roles.getBySlug(membershipId, "auditor")).get()
            .extracting(Role::id).isEqualTo("rol_auditor");
        assertThat(core.roleCache.get(membershipId)).isEmpty();
    }

    @Test
    @DisplayName("a cache hit should be answered from the cached list alone")
    void getBySlug_shouldTrustCachedList_onHit() {
        create("Editor", List.of(), List.of());
        storeDirectly("auditor");

        assertThat(core.roles.getBySlug(membershipId, "auditor")).isEmpty();

        core.roles.refreshCache(membershipId);
        assertThat(core.roles.getBySlug(membershipId, "auditor")).isPresent();
    }

    @Test
    @DisplayName("query should apply a JSON filter inside the membership")
    void query_shouldFilterInsideMembership() {
        create("Editor", List.of("blog.posts.*"), List.of());
        create("Viewer", List.of("blog.posts.read"), List.of());

        assertThat(core.roles.query(membershipId, "{\"permissions\":\"blog.posts.read\"}", Paging.all(), null).items())
            .extracting(document -> document.getString("slug")).containsExactly("viewer");
        assertThat(core.roles.list(membershipId, Paging.all()).count()).isEqualTo(2L);
    }

    // ========================================
    // DELETE TESTS
    // ========================================

    @Test
    @DisplayName("delete should refuse a reserved role for a human but allow the system")
    void delete_shouldGuardReservedRole() {
        core.roles.ensureAdministratorRole(membershipId);
        String storedId = core.roles.list(membershipId, Paging.all()).items().get(0).id();

        assertThatThrownBy(() -> core.roles.delete(admin, membershipId, storedId))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.RESERVED_NAME_VIOLATION));
        assertThat(core.roles.delete(Utilizer.system(membershipId), membershipId, storedId)).isTrue();
    }

    @Test
    @DisplayName("bulkDelete should delete what it can and report the rest")
    void bulkDelete_shouldReportPartialOutcome() {
        core.roles.ensureAdministratorRole(membershipId);
        String administratorId = core.roles.list(membershipId, Paging.all()).items().get(0).id();
        Role editor = create("Editor", List.of(), List.of());

        BulkDeleteResult result = core.roles.bulkDelete(admin, membershipId, List.of(editor.id(), administratorId));

        assertThat(result).isInstanceOf(BulkDeleteResult.Partial.class);
        assertThat(result.succeededIds()).containsExactly(editor.id());
        assertThat(result.failedIds()).containsExactly(administratorId);
        assertThat(core.roleCache.get(membershipId).orElseThrow()).hasSize(1);
    }
}
