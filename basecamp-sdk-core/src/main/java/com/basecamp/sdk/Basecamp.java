package com.basecamp.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Configured Basecamp client. Create one with {@link BasecampBuilder}, then scope it to an
 * account:
 *
 * <pre>
 * {@code
 * Basecamp basecamp = BasecampBuilder.create().accessTokenFromEnv().build();
 * AccountClient account = basecamp.forAccount("999999999");
 * ListResult<Project> projects = account.projects().list();
 * }
 * </pre>
 *
 * Instances are thread-safe and share one ETag cache across accounts.
 */
public final class Basecamp {

	private final BasecampConfig config;

	private final BasecampClient client;

	private final Paginator paginator;

	private final BasecampHooks hooks;

	private final ObjectMapper objectMapper;

	@Nullable
	private final ETagCache cache;

	Basecamp(BasecampConfig config, BasecampClient client, Paginator paginator, BasecampHooks hooks,
			ObjectMapper objectMapper, @Nullable ETagCache cache) {
		this.config = config;
		this.client = client;
		this.paginator = paginator;
		this.hooks = hooks;
		this.objectMapper = objectMapper;
		this.cache = cache;
	}

	/**
	 * Scope the client to an account.
	 * @param accountId numeric account ID
	 * @return account client
	 * @throws BasecampException with kind {@link ErrorKind#USAGE} if the ID is not
	 * numeric
	 */
	public AccountClient forAccount(String accountId) {
		if (!BasecampConfig.isNumeric(accountId)) {
			throw BasecampException.usage("Account ID must be numeric: '" + accountId + "'",
					"Find it in your Basecamp URL: https://3.basecamp.com/<account-id>/");
		}
		return new AccountClient(new ServiceContext(client, paginator, hooks, objectMapper, accountId));
	}

	public AccountClient forAccount(long accountId) {
		return forAccount(Long.toString(accountId));
	}

	/**
	 * The underlying pipeline, for requests no service covers.
	 */
	public BasecampClient client() {
		return client;
	}

	public Paginator paginator() {
		return paginator;
	}

	public BasecampConfig config() {
		return config;
	}

	public Optional<ETagCache> cache() {
		return Optional.ofNullable(cache);
	}

}
