package app.mediafill.autofill.resolve;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public interface MediaResolver {

    Map<String, ResourceInfo> resolve(List<String> ids, Duration timeout);
}
