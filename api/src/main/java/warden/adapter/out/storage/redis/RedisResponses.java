package warden.adapter.out.storage.redis;

import java.util.ArrayList;
import java.util.List;

import io.vertx.mutiny.redis.client.Response;

/**
 * Conversions for raw {@link Response} values returned by {@code execute}.
 */
final class RedisResponses {

    private RedisResponses() {}

    static long toLong(Response response) {
        if (response == null) {
            throw new IllegalStateException("Null response from Redis");
        }
        return response.toLong();
    }

    static List<String> toStrings(Response response) {
        final var result = new ArrayList<String>();
        if (response == null) {
            return result;
        }
        for (var i = 0; i < response.size(); i++) {
            final var item = response.get(i);
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
