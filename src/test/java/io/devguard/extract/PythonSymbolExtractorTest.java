package io.devguard.extract;

import io.devguard.model.EdgeKind;
import io.devguard.model.Node;
import io.devguard.model.NodeKind;
import io.devguard.model.SignatureParam;
import io.devguard.model.SourceDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonSymbolExtractorTest {

    private PythonSymbolExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PythonSymbolExtractor();
    }

    @Test
    void extract_declaresFileClassesMethodsAndFunctions() throws ParseException {
        FileContribution contribution = extract("app/repo.py", """
                class Repo:
                    def save(self, item):
                        return self.validate(item)

                    def validate(self, item):
                        return item


                def helper():
                    return Repo()
                """);

        assertThat(contribution.declarations().get(0).node().kind()).isEqualTo(NodeKind.FILE);
        assertThat(qualifiedNames(contribution))
                .containsExactly("app/repo.py", "app.repo.Repo", "app.repo.Repo.save",
                        "app.repo.Repo.validate", "app.repo.helper");
        assertThat(node(contribution, "app.repo.Repo").kind()).isEqualTo(NodeKind.CLASS);
        assertThat(node(contribution, "app.repo.Repo.save").signature())
                .containsExactly(SignatureParam.of("item"));
        assertThat(node(contribution, "app.repo.Repo.save").line()).isEqualTo(2);
    }

    @Test
    void extract_recordsCallsOnSelfAndLocalNames() throws ParseException {
        FileContribution contribution = extract("app/repo.py", """
                class Repo:
                    def save(self, item):
                        return self.validate(item)

                    def validate(self, item):
                        return len(item)


                def helper():
                    return Repo()
                """);

        String save = node(contribution, "app.repo.Repo.save").id();
        String helper = node(contribution, "app.repo.helper").id();
        String validate = node(contribution, "app.repo.Repo.validate").id();

        assertThat(referencesFrom(contribution, save, EdgeKind.CALLS))
                .containsExactly(List.of("app.repo.Repo.validate"));
        assertThat(referencesFrom(contribution, helper, EdgeKind.CALLS))
                .containsExactly(List.of("app.repo.Repo"));
        // builtins are neither imported nor declared here
        assertThat(referencesFrom(contribution, validate, EdgeKind.CALLS)).isEmpty();
    }

    @Test
    void extract_pydanticModelBecomesSchemaWithFields() throws ParseException {
        FileContribution contribution = extract("app/models.py", """
                from typing import Optional

                from pydantic import BaseModel


                class User(BaseModel):
                    id: int
                    email: Optional[str] = None
                """);

        Node user = node(contribution, "app.models.User");
        assertThat(user.kind()).isEqualTo(NodeKind.SCHEMA);
        assertThat(user.signature()).containsExactly(
                new SignatureParam("id", "int"),
                new SignatureParam("email", "Optional[str]"));
        assertThat(referencesFrom(contribution, user.id(), EdgeKind.IMPLEMENTS))
                .containsExactly(List.of("pydantic.BaseModel"));
        // typing names never become schema references
        assertThat(referencesFrom(contribution, user.id(), EdgeKind.REFERENCES_SCHEMA)).isEmpty();
    }

    @Test
    void extract_dataclassBecomesSchema() throws ParseException {
        FileContribution contribution = extract("app/geometry.py", """
                from dataclasses import dataclass


                @dataclass
                class Point:
                    x: int
                    y: int
                """);

        assertThat(node(contribution, "app.geometry.Point").kind()).isEqualTo(NodeKind.SCHEMA);
    }

    @Test
    void extract_recordsSchemaReferencesFromTypeHints() throws ParseException {
        FileContribution contribution = extract("backend/app/services.py", """
                from .models import User


                def load_user(user_id: int) -> User:
                    return User(id=user_id)
                """);

        String loadUser = node(contribution, "backend.app.services.load_user").id();
        assertThat(referencesFrom(contribution, loadUser, EdgeKind.REFERENCES_SCHEMA))
                .containsExactly(List.of("backend.app.models.User"));
        assertThat(referencesFrom(contribution, loadUser, EdgeKind.CALLS))
                .containsExactly(List.of("backend.app.models.User"));
    }

    @Test
    void extract_resolvesRelativeImports() throws ParseException {
        FileContribution contribution = extract("backend/app/routes.py", """
                from .services import load_user
                from ..core import db
                import os.path
                """);

        String fileId = contribution.declarations().get(0).node().id();
        assertThat(referencesFrom(contribution, fileId, EdgeKind.IMPORTS)).containsExactly(
                List.of("backend.app.services.load_user", "backend.app.services"),
                List.of("backend.core.db", "backend.core"),
                List.of("os.path"));
    }

    @Test
    void extract_declaresFastApiEndpointWithRouterPrefix() throws ParseException {
        FileContribution contribution = extract("backend/app/routes.py", """
                from fastapi import APIRouter

                router = APIRouter(prefix="/users")


                @router.get("/{user_id}")
                def get_user(user_id: int):
                    return None
                """);

        Declaration endpoint = declaration(contribution, "GET /users/{user_id}");
        assertThat(endpoint.node().kind()).isEqualTo(NodeKind.ENDPOINT);
        assertThat(endpoint.route()).isEqualTo(new HttpRoute("GET", "/users/{user_id}"));
        assertThat(endpoint.node().signature()).containsExactly(new SignatureParam("user_id", "int"));
        assertThat(referencesFrom(contribution, endpoint.node().id(), EdgeKind.CALLS))
                .containsExactly(List.of("backend.app.routes.get_user"));
    }

    @Test
    void extract_declaresOneEndpointPerFlaskMethod() throws ParseException {
        FileContribution contribution = extract("app/views.py", """
                from flask import Flask

                app = Flask(__name__)


                @app.route("/login", methods=["GET", "POST"])
                def login():
                    return "ok"
                """);

        assertThat(contribution.declarations())
                .filteredOn(d -> d.route() != null)
                .extracting(d -> d.route().display())
                .containsExactly("GET /login", "POST /login");
    }

    @Test
    void extract_foldsNestedFunctionsIntoTheirParent() throws ParseException {
        FileContribution contribution = extract("app/jobs.py", """
                def outer():
                    def inner():
                        return helper()
                    return inner()


                def helper():
                    return 1
                """);

        assertThat(qualifiedNames(contribution)).containsExactly("app/jobs.py", "app.jobs.outer", "app.jobs.helper");
        assertThat(referencesFrom(contribution, node(contribution, "app.jobs.outer").id(), EdgeKind.CALLS))
                .containsExactly(List.of("app.jobs.helper"));
    }

    @Test
    void extract_packageInitDeclaresModuleNode() throws ParseException {
        FileContribution contribution = extract("app/__init__.py", "from .models import User\n");

        Node module = node(contribution, "app");
        assertThat(module.kind()).isEqualTo(NodeKind.MODULE);
        assertThat(module.path()).isEqualTo("app/__init__.py");
        assertThat(contribution.declarations().get(0).aliases()).containsExactly("app.__init__");
    }

    @Test
    void extract_ignoresCallsInsideStringsAndComments() throws ParseException {
        FileContribution contribution = extract("app/util.py", """
                def helper():
                    return 1


                def caller():
                    # helper() is not called here
                    return "helper()"
                """);

        assertThat(referencesFrom(contribution, node(contribution, "app.util.caller").id(), EdgeKind.CALLS)).isEmpty();
    }

    @Test
    void extract_rejectsUnclosedBracket() {
        assertThatThrownBy(() -> extract("broken/bad.py", "x = (1, 2\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("'(' was never closed")
                .extracting(e -> ((ParseException) e).line())
                .isEqualTo(1);
    }

    @Test
    void extract_rejectsUnexpectedIndent() {
        assertThatThrownBy(() -> extract("broken/indent.py", "x = 1\n    y = 2\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unexpected indent");
    }

    @Test
    void extract_rejectsMissingBlock() {
        assertThatThrownBy(() -> extract("broken/block.py", "def f():\nx = 1\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("expected an indented block");
    }

    private FileContribution extract(String path, String content) throws ParseException {
        return extractor.extract(SourceDocument.of(path, content));
    }

    static List<String> qualifiedNames(FileContribution contribution) {
        return contribution.declarations().stream().map(d -> d.node().qualifiedName()).toList();
    }

    static Declaration declaration(FileContribution contribution, String qualifiedName) {
        return contribution.declarations().stream()
                .filter(d -> d.node().qualifiedName().equals(qualifiedName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No declaration " + qualifiedName));
    }

    static Node node(FileContribution contribution, String qualifiedName) {
        return declaration(contribution, qualifiedName).node();
    }

    static List<List<String>> referencesFrom(FileContribution contribution, String sourceId, EdgeKind kind) {
        return contribution.references().stream()
                .filter(r -> r.sourceId().equals(sourceId) && r.kind() == kind)
                .map(SymbolReference::candidates)
                .toList();
    }
}
