package com.vuong.restkit.core.resource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vuong.restkit.core.domain.DomainModel;
import com.vuong.restkit.core.pipeline.RequestPipeline;
import com.vuong.restkit.core.pipeline.ResourceRequest;
import com.vuong.restkit.core.schema.SchemaFactory;
import com.vuong.restkit.core.validation.RequestDataValidator;
import com.vuong.restkit.dto.PageResponse;
import com.vuong.restkit.support.Book;
import com.vuong.restkit.support.BookDto;
import com.vuong.restkit.support.InMemoryBookModel;
import com.vuong.restkit.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.RequestMethod;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("ListCreateResource Tests")
class ListCreateResourceTest {

    private static final URI BOOKS = URI.create("http://testserver/api/books");

    private ObjectMapper objectMapper;
    private RequestPipeline pipeline;
    private ResourceSchemas<Book> schemas;
    private InMemoryBookModel model;
    private ListCreateResource<Book> resource;

    @BeforeEach
    void setUp() {
        objectMapper = TestFixtures.objectMapper();
        pipeline = new RequestPipeline(new RequestDataValidator(objectMapper));
        SchemaFactory schemaFactory = TestFixtures.schemaFactory(objectMapper);
        schemas = ResourceSchemas.<Book>builder(schemaFactory.forType(BookDto.class))
                .request(RequestMethod.GET, schemaFactory.passThrough())
                .build();
        model = new InMemoryBookModel(objectMapper);
        resource = new ListCreateResource<>("books", model, schemas, TestFixtures.paginator());
    }

    private ResponseEntity<Object> post(String body) {
        return pipeline.process(resource, ResourceRequest.builder().method("POST").body(body).resourceUri(BOOKS).build());
    }

    private ResponseEntity<Object> get(MultiValueMap<String, String> query) {
        return pipeline.process(resource,
                ResourceRequest.builder().method("GET").queryParams(query).resourceUri(BOOKS).build());
    }

    @Test
    @DisplayName("Should allow exactly GET and POST on the collection")
    void shouldBindListAndCreate() {
        assertThat(resource.getKind()).isEqualTo(ResourceKind.COLLECTION);
        assertThat(resource.getAllowedMethods()).containsExactly(RequestMethod.GET, RequestMethod.POST);
    }

    @Test
    @DisplayName("Should create an item and answer with its serialized form")
    @SuppressWarnings("unchecked")
    void shouldCreateItem() {
        // When
        ResponseEntity<Object> response = post("{\"title\":\"Dune\",\"pages\":412,\"id\":99}");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = (Map<String, Object>) response.getBody();
        assertThat(body).containsEntry("title", "Dune").containsEntry("pages", 412);
        assertThat(((Number) body.get("id")).longValue()).isEqualTo(1L);
        assertThat(model.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not touch the model when the body is malformed")
    @SuppressWarnings("unchecked")
    void shouldNotTouchModelOnMalformedBody() {
        // Given
        DomainModel<Book> untouched = mock(DomainModel.class);
        ListCreateResource<Book> guarded = new ListCreateResource<>("books", untouched, schemas, TestFixtures.paginator());

        // When
        ResponseEntity<Object> response = pipeline.process(guarded,
                ResourceRequest.builder().method("POST").body("{\"title\":").build());

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(untouched);
    }

    @Test
    @DisplayName("Should not touch the model when a valid object is followed by more content")
    @SuppressWarnings("unchecked")
    void shouldNotTouchModelOnTrailingContent() {
        // Given
        DomainModel<Book> untouched = mock(DomainModel.class);
        ListCreateResource<Book> guarded = new ListCreateResource<>("books", untouched, schemas, TestFixtures.paginator());

        // When
        ResponseEntity<Object> garbage = pipeline.process(guarded,
                ResourceRequest.builder().method("POST").body("{\"title\":\"Dune\"} oops").build());
        ResponseEntity<Object> twoObjects = pipeline.process(guarded,
                ResourceRequest.builder().method("POST").body("{\"title\":\"Dune\"}{\"title\":\"Emma\"}").build());

        // Then
        assertThat(garbage.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(twoObjects.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(untouched);
    }

    @Test
    @DisplayName("Should retrieve exactly what create answered with")
    void shouldRetrieveWhatWasCreated() {
        // Given
        RetrieveUpdateResource<Book> item = new RetrieveUpdateResource<>("books", model, schemas);

        // When
        ResponseEntity<Object> created = post("{\"title\":\"Dune\",\"pages\":412}");
        Object id = ((Map<?, ?>) created.getBody()).get("id");
        ResponseEntity<Object> retrieved = pipeline.process(item, ResourceRequest.builder()
                .method("GET")
                .pathVariables(Map.of(RetrieveUpdateResource.ID_VARIABLE, String.valueOf(id)))
                .build());

        // Then
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(retrieved.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(retrieved.getBody()).isEqualTo(created.getBody());
    }

    @Test
    @DisplayName("Should not save an item that fails validation")
    void shouldNotSaveInvalidItem() {
        // When
        ResponseEntity<Object> response = post("{\"pages\":0}");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(model.size()).isZero();
    }

    @Test
    @DisplayName("Should list the requested page with links to its neighbours")
    void shouldListPage() {
        // Given
        for (int i = 1; i <= 5; i++) {
            post("{\"title\":\"Volume " + i + "\",\"pages\":" + (100 + i) + "}");
        }
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("page", "2");
        query.add("page_size", "2");

        // When
        ResponseEntity<Object> response = get(query);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        PageResponse page = (PageResponse) response.getBody();
        assertThat(page.getCount()).isEqualTo(5);
        assertThat(page.getPrevious()).isEqualTo("http://testserver/api/books?page=1&page_size=2");
        assertThat(page.getNext()).isEqualTo("http://testserver/api/books?page=3&page_size=2");
        List<Object> titles = page.getResult().stream()
                .<Object>map(item -> ((Map<?, ?>) item).get("title"))
                .collect(Collectors.toList());
        assertThat(titles).containsExactly("Volume 3", "Volume 4");
    }

    @Test
    @DisplayName("Should filter by the remaining query parameters")
    void shouldFilterList() {
        // Given
        post("{\"title\":\"Dune\",\"pages\":412}");
        post("{\"title\":\"Emma\",\"pages\":474}");
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("title", "Emma");

        // When
        PageResponse page = (PageResponse) get(query).getBody();

        // Then
        assertThat(page.getCount()).isEqualTo(1);
        assertThat(page.getNext()).isNull();
        assertThat(page.getPrevious()).isNull();
        assertThat(page.getResult()).hasSize(1);
    }

    @Test
    @DisplayName("Should answer an empty page past the end of the collection")
    void shouldAnswerEmptyPagePastTheEnd() {
        // Given
        post("{\"title\":\"Dune\"}");
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("page", "7");

        // When
        PageResponse page = (PageResponse) get(query).getBody();

        // Then
        assertThat(page.getResult()).isEmpty();
        assertThat(page.getPrevious()).isEqualTo("http://testserver/api/books?page=1");
        assertThat(page.getNext()).isNull();
    }

    @Test
    @DisplayName("Should reject a page number that is not an integer")
    void shouldRejectBadPageNumber() {
        // Given
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("page", "last");

        // When
        ResponseEntity<Object> response = get(query);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
