package app.mstudio.render.provider.runway;

import java.util.List;

public record RunwayTask(
        String id,
        String status,
        Double progress,
        List<String> output,
        String thumbnail,
        String failure
) {
}
