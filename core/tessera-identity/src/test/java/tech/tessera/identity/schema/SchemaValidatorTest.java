package tech.tessera.identity.schema;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tessera.identity.common.Utilizer;
import tech.tessera.identity.common.errors.ErrorKind;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.IdentityException;
import tech.tessera.identity.common.errors.ValidationErrors;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.test.CoreFixture;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaValidator over an in-memory store.
 */
class SchemaValidatorTest {

    private static final String USERS = "users";

    private CoreFixture core;
    private String membershipId;
    private UserType baseUser;
    private UserType employee;

    @BeforeEach
    void setUp() {
        core = new CoreFixture();
        membershipId = core.membership("Acme").id();
        baseUser = UserTypeService.originType(membershipId);
        employee = core.userTypes.create(Utilizer.system(membershipId), membershipId, new UserType(
            null, null, "Employee", null, null, UserTypeService.ORIGIN_TYPE, false,
            List.of(
                PropertyDefinition.unique("employee_no", FieldType.INTEGER),
                PropertyDefinition.reference("manager", ReferenceCardinality.SINGLE, "employee"),
                PropertyDefinition.reference("buddies", ReferenceCardinality.MULTIPLE, null)),
            List.of("employee_no"),
            null));
    }

    private DynamicDocument storedUser(String id, String userType) {
        DynamicDocument document = DynamicDocument.parse("{\"_id\":\"" + id + "\",\"membership_id\":\"" + membershipId
            + "\",\"username\":\"" + id + "\",\"user_type\":\"" + userType + "\",\"password_hash\":\"secret\"}");
        core.store.collection(USERS).insert(document);
        return document;
    }

    private ValidationErrors validate(DynamicDocument document, UserType type, ValidationContext context) {
        ValidationErrors errors = new ValidationErrors();
        core.schemaValidator.validate(document, type, context, errors);
        return errors;
    }

    private static List<String> codes(ValidationErrors errors) {
        return errors.asList().stream().map(FieldError::code).toList();
    }

    // ========================================
    // STRUCTURE TESTS
    // ========================================

    @Test
    @DisplayName("validate should report every missing required field and type mismatch at once")
    void validate_shouldAccumulateStructuralErrors() {
        // Arrange
        DynamicDocument document = DynamicDocument.parse(
            "{\"username\":\"ann\",\"email_address\":\"not-an-email\",\"employee_no\":\"seven\",\"user_type\":\"employee\"}");

        // Act
        ValidationErrors errors = validate(document, employee, ValidationContext.forCreate(membershipId, USERS));

        // Assert
        assertThat(errors.asList()).extracting(FieldError::field)
            .contains("role", "email_address", "employee_no");
        assertThat(codes(errors)).contains("REQUIRED", "INVALID_TYPE");
    }

    @Test
    @DisplayName("validate should inherit required fields from the base type")
    void validate_shouldInheritRequiredFields() {
        DynamicDocument document = DynamicDocument.parse("{\"employee_no\":7,\"user_type\":\"employee\"}");

        ValidationErrors errors = validate(document, employee, ValidationContext.forCreate(membershipId, USERS));

        assertThat(errors.asList()).extracting(FieldError::field)
            .containsExactlyInAnyOrder("username", "email_address", "role");
    }

    // ========================================
    // UNIQUENESS TESTS
    // ========================================

    @Test
    @DisplayName("validate should flag a unique value held by another document")
    void validate_shouldFlagUniqueValueHeldByOther() {
        storedUser("usr_1", UserTypeService.ORIGIN_TYPE);
        DynamicDocument document = DynamicDocument.parse(
            "{\"username\":\"usr_1\",\"email_address\":\"b@acme.test\",\"role\":\"administrator\"}");

        ValidationErrors errors = validate(document, baseUser, ValidationContext.forCreate(membershipId, USERS));

        assertThat(errors.asList()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("username");
            assertThat(error.kind()).isEqualTo(ErrorKind.ALREADY_EXISTS);
        });
    }

    @Test
    @DisplayName("validate should not count the document being updated as a holder of its own value")
    void validate_shouldExcludeSelf_whenUpdating() {
        DynamicDocument prior = storedUser("usr_1", UserTypeService.ORIGIN_TYPE);
        DynamicDocument merged = DynamicDocument.parse(
            "{\"username\":\"usr_1\",\"email_address\":\"a@acme.test\",\"role\":\"administrator\",\"user_type\":\"base-user\"}");

        ValidationErrors errors = validate(merged, baseUser, ValidationContext.forUpdate(membershipId, USERS, prior));

        assertThat(errors.isEmpty()).isTrue();
    }

    // ========================================
    // REFERENCE TESTS
    // ========================================

    @Test
    @DisplayName("validate should embed a resolved single reference without hidden fields")
    void validate_shouldEmbedResolvedReference() {
        storedUser("boss", "employee");
        DynamicDocument document = DynamicDocument.parse("{\"username\":\"ann\",\"email_address\":\"a@acme.test\","
            + "\"role\":\"administrator\",\"employee_no\":1,\"manager\":\"boss\"}");

        ValidationErrors errors = validate(document, employee, ValidationContext.forCreate(membershipId, USERS));

        assertThat(errors.isEmpty()).isTrue();
        assertThat(document.getString("manager._id")).isEqualTo("boss");
        assertThat(document.contains("manager.password_hash")).isFalse();
    }

    @Test
    @DisplayName("validate should reject a reference whose target is of an unrelated type")
    void validate_shouldRejectReference_whenContentTypeMismatches() {
        storedUser("plain", UserTypeService.ORIGIN_TYPE);
        DynamicDocument document = DynamicDocument.parse("{\"username\":\"ann\",\"email_address\":\"a@acme.test\","
            + "\"role\":\"administrator\",\"employee_no\":1,\"manager\":\"plain\"}");

        ValidationErrors errors = validate(document, employee, ValidationContext.forCreate(membershipId, USERS));

        assertThat(codes(errors)).containsExactly("CONTENT_TYPE_MISMATCH");
        assertThat(document.getString("manager")).isEqualTo("plain");
    }

    @Test
    @DisplayName("validate should not resolve a reference to a document of another membership")
    void validate_shouldRejectReference_whenTargetBelongsToOtherMembership() {
        // Arrange
        String otherMembershipId = core.membership("Globex").id();
        core.store.collection(USERS).insert(DynamicDocument.parse("{\"_id\":\"boss\",\"membership_id\":\""
            + otherMembershipId + "\",\"username\":\"boss\",\"user_type\":\"employee\"}"));
        DynamicDocument document = DynamicDocument.parse("{\"username\":\"ann\",\"email_address\":\"a@acme.test\","
            + "\"role\":\"administrator\",\"employee_no\":1,\"manager\":\"boss\"}");

        // Act
        ValidationErrors errors = validate(document, employee, ValidationContext.forCreate(membershipId, USERS));

        // Assert
        assertThat(errors.asList()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("manager");
            assertThat(error.code()).isEqualTo("REFERENCE_NOT_FOUND");
        });
        assertThat(document.getString("manager")).isEqualTo("boss");
    }

    @Test
    @DisplayName("validate should reject a typed reference whose target declares no user type")
    void validate_shouldRejectReference_whenTargetHasNoContentType() {
        core.store.collection(USERS).insert(DynamicDocument.parse("{\"_id\":\"untyped\",\"membership_id\":\""
            + membershipId + "\",\"username\":\"untyped\"}"));
        DynamicDocument document = DynamicDocument.parse("{\"username\":\"ann\",\"email_address\":\"a@acme.test\","
            + "\"role\":\"administrator\",\"employee_no\":1,\"manager\":\"untyped\"}");

        ValidationErrors errors = validate(document, employee, ValidationContext.forCreate(membershipId, USERS));

        assertThat(codes(errors)).containsExactly("CONTENT_TYPE_MISSING");
        assertThat(document.getString("manager")).isEqualTo("untyped");
    }

    @Test
    @DisplayName("validate should leave a multi-reference untouched and report the missing element")
    void validate_shouldLeaveMultiReferenceUntouched_whenAnElementIsMissing() {
        storedUser("usr_1", UserTypeService.ORIGIN_TYPE);
        DynamicDocument document = DynamicDocument.parse("{\"username\":\"ann\",\"email_address\":\"a@acme.test\","
            + "\"role\":\"administrator\",\"employee_no\":1,\"buddies\":[\"usr_1\",\"ghost\"]}");

        ValidationErrors errors = validate(document, employee, ValidationContext.forCreate(membershipId, USERS));

        assertThat(errors.asList()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("buddies.1");
            assertThat(error.code()).isEqualTo("REFERENCE_NOT_FOUND");
        });
        assertThat(document.getStringList("buddies")).containsExactly("usr_1", "ghost");
    }

    // ========================================
    // TYPE RULE TESTS
    // ========================================

    @Test
    @DisplayName("validate should refuse an abstract user type")
    void validate_shouldRefuseAbstractType() {
        UserType person = core.userTypes.create(Utilizer.system(membershipId), membershipId, new UserType(
            null, null, "Person", null, null, null, true, List.of(), List.of(), null));

        assertThatThrownBy(() -> validate(new DynamicDocument(), person, ValidationContext.forCreate(membershipId, USERS)))
            .isInstanceOfSatisfying(IdentityException.class,
                e -> assertThat(e.code()).isEqualTo("ABSTRACT_USER_TYPE"));
    }

    @Test
    @DisplayName("validate should refuse to change the user type of an existing user")
    void validate_shouldRefuseUserTypeChange() {
        DynamicDocument prior = storedUser("usr_1", UserTypeService.ORIGIN_TYPE);
        DynamicDocument merged = prior.copy();
        merged.set("user_type", "employee");

        assertThatThrownBy(() -> validate(merged, employee, ValidationContext.forUpdate(membershipId, USERS, prior)))
            .isInstanceOfSatisfying(IdentityException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.IMMUTABLE);
                assertThat(e.code()).isEqualTo("USER_USER_TYPE_IMMUTABLE");
            });
    }

    @Test
    @DisplayName("validate should report user-level permission conflicts")
    void validate_shouldReportUserPermissionConflicts() {
        DynamicDocument document = DynamicDocument.parse("{\"username\":\"ann\",\"email_address\":\"a@acme.test\","
            + "\"role\":\"administrator\",\"permissions\":[\"users.read.usr_9\"],\"forbidden\":[\"users.read.usr_9\"]}");

        ValidationErrors errors = validate(document, baseUser, ValidationContext.forCreate(membershipId, USERS));

        assertThat(errors.asList()).singleElement()
            .satisfies(error -> assertThat(error.kind()).isEqualTo(ErrorKind.CONFLICTING_PATTERNS));
    }
}
