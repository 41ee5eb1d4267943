package com.basecamp.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Paginator Tests")
class PaginatorTest {

	private static final String BASE = "https://3.basecampapi.com";

	private FakePages pages;

	private Paginator paginator;

	@BeforeEach
	void setUp() {
		pages = new FakePages();
		paginator = new Paginator(pages, ObjectMapperFactory.create(), 100);
	}

	private static String ids(int from, int to) {
		StringBuilder json = new StringBuilder("[");
		for (int id = from; id <= to; id++) {
			if (id > from) {
				json.append(',');
			}
			json.append("{\"id\":").append(id).append(",\"name\":\"p").append(id).append("\"}");
		}
		return json.append(']').toString();
	}

	private static List<Long> idsOf(List<Project> projects) {
		return projects.stream().map(Project::id).collect(Collectors.toList());
	}

	@Test
	@DisplayName("Should follow next links until the last page")
	void shouldFollowNextLinks() {
		pages.page("/999/projects.json", ids(1, 2), "</999/projects.json?page=2>; rel=\"next\"", "5");
		pages.page("/999/projects.json?page=2", ids(3, 4), "<" + BASE + "/999/projects.json?page=3>; rel=\"next\"",
				null);
		pages.page("/999/projects.json?page=3", ids(5, 5), null, null);

		ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
				PaginationOptions.defaults());

		assertThat(idsOf(result)).containsExactly(1L, 2L, 3L, 4L, 5L);
		assertThat(result.totalCount()).isEqualTo(5);
		assertThat(result.isTruncated()).isFalse();
		assertThat(pages.requested).hasSize(3);
	}

	@Test
	@DisplayName("Should keep the operation name on follow-up pages")
	void shouldKeepOperationName() {
		pages.page("/999/projects.json", ids(1, 1), "</999/projects.json?page=2>; rel=\"next\"", null);
		pages.page("/999/projects.json?page=2", ids(2, 2), null, null);

		paginator.paginate(RequestSpec.get("/999/projects.json").withOperation("ListProjects"), Project.class,
				PaginationOptions.defaults());

		assertThat(pages.operations).containsExactly("ListProjects", "ListProjects");
	}

	@Test
	@DisplayName("Should find the next link among repeated Link header lines")
	void shouldReadRepeatedLinkHeaders() {
		pages.page("/999/projects.json?page=2", ids(2, 2), null, null);
		pages.links("/999/projects.json?page=2", "</999/projects.json?page=1>; rel=\"prev\"",
				"</999/projects.json?page=3>; rel=\"next\"");
		pages.page("/999/projects.json?page=3", ids(3, 3), null, null);

		ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json?page=2"), Project.class,
				PaginationOptions.defaults());

		assertThat(idsOf(result)).containsExactly(2L, 3L);
		assertThat(result.isTruncated()).isFalse();
		assertThat(pages.requested).containsExactly(BASE + "/999/projects.json?page=2",
				BASE + "/999/projects.json?page=3");
	}

	@Nested
	@DisplayName("Origin Guard Tests")
	class OriginGuardTest {

		@Test
		@DisplayName("Should refuse a cross-origin next link without requesting it")
		void shouldRefuseCrossOriginLink() {
			pages.page("/999/projects.json", ids(1, 2), "<https://evil.example.com/steal?page=2>; rel=\"next\"",
					null);

			assertThatThrownBy(() -> paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.defaults()))
				.isInstanceOf(BasecampException.class)
				.hasMessageContaining("different origin")
				.satisfies(e -> assertThat(((BasecampException) e).getKind()).isEqualTo(ErrorKind.API));
			assertThat(pages.requested).containsExactly(BASE + "/999/projects.json");
		}

		@Test
		@DisplayName("Should refuse a scheme downgrade")
		void shouldRefuseSchemeDowngrade() {
			pages.page("/999/projects.json", ids(1, 1), "<http://3.basecampapi.com/999/projects.json?page=2>; rel=next",
					null);

			assertThatThrownBy(() -> paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.defaults()))
				.isInstanceOf(BasecampException.class);
			assertThat(pages.requested).hasSize(1);
		}

		@Test
		@DisplayName("Should accept an explicit default port")
		void shouldAcceptExplicitDefaultPort() {
			pages.page("/999/projects.json", ids(1, 1),
					"<https://3.basecampapi.com:443/999/projects.json?page=2>; rel=\"next\"", null);
			pages.pages.put("https://3.basecampapi.com:443/999/projects.json?page=2", ids(2, 2));

			ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.defaults());

			assertThat(result).hasSize(2);
		}

	}

	@Nested
	@DisplayName("Limit Tests")
	class LimitTest {

		@Test
		@DisplayName("Should stop at the page cap and mark truncated")
		void shouldStopAtPageCap() {
			Paginator capped = new Paginator(pages, ObjectMapperFactory.create(), 2);
			pages.page("/999/projects.json", ids(1, 1), "</999/projects.json?page=2>; rel=\"next\"", null);
			pages.page("/999/projects.json?page=2", ids(2, 2), "</999/projects.json?page=3>; rel=\"next\"", null);

			ListResult<Project> result = capped.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.defaults());

			assertThat(idsOf(result)).containsExactly(1L, 2L);
			assertThat(result.isTruncated()).isTrue();
			assertThat(pages.requested).hasSize(2);
		}

		@Test
		@DisplayName("Should let callers lower the page cap")
		void shouldHonorCallerPageCap() {
			pages.page("/999/projects.json", ids(1, 1), "</999/projects.json?page=2>; rel=\"next\"", null);

			ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.defaults().withMaxPages(1));

			assertThat(result.isTruncated()).isTrue();
			assertThat(pages.requested).hasSize(1);
		}

		@Test
		@DisplayName("Should stop fetching once max items are collected")
		void shouldStopAtMaxItems() {
			pages.page("/999/projects.json", ids(1, 3), "</999/projects.json?page=2>; rel=\"next\"", "9");
			pages.page("/999/projects.json?page=2", ids(4, 6), "</999/projects.json?page=3>; rel=\"next\"", null);

			ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.maxItems(4));

			assertThat(idsOf(result)).containsExactly(1L, 2L, 3L, 4L);
			assertThat(result.isTruncated()).isTrue();
			assertThat(result.totalCount()).isEqualTo(9);
			assertThat(pages.requested).hasSize(2);
		}

		@Test
		@DisplayName("Should trim a single page to max items")
		void shouldTrimSinglePage() {
			pages.page("/999/projects.json", ids(1, 5), null, null);

			ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.maxItems(2));

			assertThat(result).hasSize(2);
			assertThat(result.isTruncated()).isTrue();
		}

		@Test
		@DisplayName("Should not mark an exact fit as truncated")
		void shouldNotTruncateExactFit() {
			pages.page("/999/projects.json", ids(1, 2), null, null);

			ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.maxItems(2));

			assertThat(result.isTruncated()).isFalse();
		}

	}

	@Nested
	@DisplayName("Page Decoding Tests")
	class DecodingTest {

		@Test
		@DisplayName("Should continue past an empty page with a next link")
		void shouldContinuePastEmptyPage() {
			pages.page("/999/projects.json", "[]", "</999/projects.json?page=2>; rel=\"next\"", null);
			pages.page("/999/projects.json?page=2", ids(1, 1), null, null);

			ListResult<Project> result = paginator.paginate(RequestSpec.get("/999/projects.json"), Project.class,
					PaginationOptions.defaults());

			assertThat(idsOf(result)).containsExactly(1L);
		}

		@Test
		@DisplayName("Should treat an empty body as no items")
		void shouldTreatEmptyBodyAsNoItems() {
			pages.page("/999/projects.json", "", null, null);

			assertThat(paginator.paginate(RequestSpec.get("/999/projects.json"), JsonNode.class,
					PaginationOptions.defaults()))
				.isEmpty();
		}

		@Test
		@DisplayName("Should reject non-array pages")
		void shouldRejectNonArrayPages() {
			pages.page("/999/projects.json", "{\"id\":1}", null, null);

			assertThatThrownBy(() -> paginator.paginate(RequestSpec.get("/999/projects.json"), JsonNode.class,
					PaginationOptions.defaults()))
				.isInstanceOf(BasecampException.class)
				.hasMessageContaining("Expected a JSON array");
		}

		@Test
		@DisplayName("Should reject malformed JSON")
		void shouldRejectMalformedJson() {
			pages.page("/999/projects.json", "[{", null, null);

			assertThatThrownBy(() -> paginator.paginate(RequestSpec.get("/999/projects.json"), JsonNode.class,
					PaginationOptions.defaults()))
				.isInstanceOf(BasecampException.class)
				.hasMessageContaining("Failed to parse response");
		}

	}

	@Nested
	@DisplayName("Streaming Tests")
	class StreamTest {

		@Test
		@DisplayName("Should fetch pages lazily")
		void shouldFetchLazily() {
			pages.page("/999/projects.json", ids(1, 2), "</999/projects.json?page=2>; rel=\"next\"", null);
			pages.page("/999/projects.json?page=2", ids(3, 4), null, null);

			List<Project> firstTwo = paginator.stream(RequestSpec.get("/999/projects.json"), Project.class)
				.limit(2)
				.collect(Collectors.toList());

			assertThat(idsOf(firstTwo)).containsExactly(1L, 2L);
			assertThat(pages.requested).hasSize(1);
		}

		@Test
		@DisplayName("Should stream every page")
		void shouldStreamAllPages() {
			pages.page("/999/projects.json", ids(1, 2), "</999/projects.json?page=2>; rel=\"next\"", null);
			pages.page("/999/projects.json?page=2", ids(3, 3), null, null);

			assertThat(paginator.stream(RequestSpec.get("/999/projects.json"), Project.class).count()).isEqualTo(3);
		}

		@Test
		@DisplayName("Should follow repeated Link header lines while streaming")
		void shouldStreamRepeatedLinkHeaders() {
			pages.page("/999/projects.json", ids(1, 1), null, null);
			pages.links("/999/projects.json", "</999/projects.json?page=0>; rel=\"prev\"",
					"</999/projects.json?page=2>; rel=\"next\"");
			pages.page("/999/projects.json?page=2", ids(2, 2), null, null);

			assertThat(paginator.stream(RequestSpec.get("/999/projects.json"), Project.class).count()).isEqualTo(2);
			assertThat(pages.requested).hasSize(2);
		}

		@Test
		@DisplayName("Should apply the origin guard while streaming")
		void shouldGuardOriginWhileStreaming() {
			pages.page("/999/projects.json", ids(1, 1), "<https://evil.example.com/x>; rel=\"next\"", null);

			assertThatThrownBy(() -> paginator.stream(RequestSpec.get("/999/projects.json"), Project.class).count())
				.isInstanceOf(BasecampException.class);
			assertThat(pages.requested).hasSize(1);
		}

	}

	@Test
	@DisplayName("Should reject a non-positive page cap")
	void shouldRejectNonPositiveCap() {
		assertThatThrownBy(() -> new Paginator(pages, ObjectMapperFactory.create(), 0))
			.isInstanceOf(IllegalArgumentException.class);
	}

	/**
	 * Serves canned pages keyed by absolute URL and records what was requested.
	 */
	private static class FakePages implements BasecampClient {

		final Map<String, String> pages = new HashMap<>();

		final Map<String, Map<String, List<String>>> headers = new HashMap<>();

		final List<String> requested = new ArrayList<>();

		final List<String> operations = new ArrayList<>();

		void page(String path, String body, String link, String totalCount) {
			Map<String, List<String>> pageHeaders = new HashMap<>();
			if (link != null) {
				pageHeaders.put("Link", List.of(link));
			}
			if (totalCount != null) {
				pageHeaders.put("X-Total-Count", List.of(totalCount));
			}
			pages.put(BASE + path, body);
			headers.put(BASE + path, pageHeaders);
		}

		void links(String path, String... links) {
			headers.get(BASE + path).put("Link", List.of(links));
		}

		@Override
		public ApiResponse execute(RequestSpec spec, int attempt) {
			URI uri = resolve(spec);
			requested.add(uri.toString());
			operations.add(spec.operationName());
			String body = pages.get(uri.toString());
			if (body == null) {
				throw BasecampException.fromHttpStatus(404, null, null, null, null, false);
			}
			return new ApiResponse(uri, 200, headers.getOrDefault(uri.toString(), Map.of()),
					body.getBytes(StandardCharsets.UTF_8), false);
		}

		@Override
		public URI resolve(RequestSpec spec) {
			return spec.path().startsWith("https://") ? URI.create(spec.path()) : URI.create(BASE + spec.path());
		}

	}

}
