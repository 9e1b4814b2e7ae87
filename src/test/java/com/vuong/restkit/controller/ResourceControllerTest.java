package com.vuong.restkit.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vuong.restkit.core.pipeline.RequestPipeline;
import com.vuong.restkit.core.resource.ListCreateResource;
import com.vuong.restkit.core.resource.ResourceRegistry;
import com.vuong.restkit.core.resource.ResourceSchemas;
import com.vuong.restkit.core.resource.RetrieveUpdateResource;
import com.vuong.restkit.core.schema.SchemaFactory;
import com.vuong.restkit.core.validation.RequestDataValidator;
import com.vuong.restkit.exception.RestKitExceptionHandler;
import com.vuong.restkit.support.Book;
import com.vuong.restkit.support.BookDto;
import com.vuong.restkit.support.BookPatchDto;
import com.vuong.restkit.support.InMemoryBookModel;
import com.vuong.restkit.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.RequestMethod;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("ResourceController Tests")
class ResourceControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = TestFixtures.objectMapper();
        SchemaFactory schemaFactory = TestFixtures.schemaFactory(objectMapper);
        ResourceSchemas<Book> schemas = ResourceSchemas.<Book>builder(schemaFactory.forType(BookDto.class))
                .request(RequestMethod.GET, schemaFactory.passThrough())
                .request(RequestMethod.PATCH, schemaFactory.forType(BookPatchDto.class))
                .build();
        InMemoryBookModel model = new InMemoryBookModel(objectMapper);
        ResourceRegistry registry = new ResourceRegistry(List.of(
                new ListCreateResource<>("books", model, schemas, TestFixtures.paginator()),
                new RetrieveUpdateResource<>("books", model, schemas)));
        ResourceController controller = new ResourceController(registry,
                new RequestPipeline(new RequestDataValidator(objectMapper)));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestKitExceptionHandler())
                .addPlaceholderValue("restkit.api-prefix", "/api")
                .build();
    }

    private void createBook(String title) throws Exception {
        mockMvc.perform(post("/api/books")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"" + title + "\",\"pages\":100}"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Should create a book and return it")
    void shouldCreateBook() throws Exception {
        mockMvc.perform(post("/api/books")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Dune\",\"pages\":412}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.title").value("Dune"))
                .andExpect(jsonPath("$.pages").value(412));
    }

    @Test
    @DisplayName("Should retrieve a created book exactly as create returned it")
    void shouldRetrieveCreatedBook() throws Exception {
        String created = mockMvc.perform(post("/api/books")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Dune\",\"pages\":412}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        mockMvc.perform(get("/api/books/1"))
                .andExpect(status().isOk())
                .andExpect(content().json(created, true));
    }

    @Test
    @DisplayName("Should answer 400 for a page beyond the reachable range")
    void shouldRejectUnreachablePage() throws Exception {
        mockMvc.perform(get("/api/books").param("page", "2147483647").param("page_size", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.page[0]").value("Must be less than or equal to 214748365."));
    }

    @Test
    @DisplayName("Should list books in the page envelope")
    void shouldListBooks() throws Exception {
        createBook("Dune");
        createBook("Emma");

        mockMvc.perform(get("/api/books").param("page_size", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.next").value("http://localhost/api/books?page_size=1&page=2"))
                .andExpect(jsonPath("$.previous").value(nullValue()))
                .andExpect(jsonPath("$.result", hasSize(1)))
                .andExpect(jsonPath("$.result[0].title").value("Dune"));
    }

    @Test
    @DisplayName("Should retrieve and update a single book")
    void shouldRetrieveAndUpdateBook() throws Exception {
        createBook("Dune");

        mockMvc.perform(patch("/api/books/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pages\":412}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pages").value(412));

        mockMvc.perform(get("/api/books/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Dune"))
                .andExpect(jsonPath("$.pages").value(412));
    }

    @Test
    @DisplayName("Should answer 405 with an Allow header and no body")
    void shouldAnswerMethodNotAllowed() throws Exception {
        mockMvc.perform(delete("/api/books"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string("Allow", "GET,POST"))
                .andExpect(content().string(""));

        mockMvc.perform(put("/api/books/1").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string("Allow", "GET,PATCH"));
    }

    @Test
    @DisplayName("Should answer 400 for a body that is not JSON")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/books")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value(RequestDataValidator.PARSE_ERROR));
    }

    @Test
    @DisplayName("Should answer 400 with field errors for invalid data")
    void shouldRejectInvalidData() throws Exception {
        createBook("Dune");

        mockMvc.perform(patch("/api/books/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pages\":\"many\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Validation failed"))
                .andExpect(jsonPath("$.fieldErrors.pages[0]").value("Not a valid integer."));
    }

    @Test
    @DisplayName("Should answer 404 for unknown resources and items")
    void shouldAnswerNotFound() throws Exception {
        mockMvc.perform(get("/api/authors"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details").value("Not found."));

        mockMvc.perform(get("/api/books/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details").value("Not found."));
    }
}
