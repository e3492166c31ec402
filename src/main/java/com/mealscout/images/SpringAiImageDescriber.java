package com.mealscout.images;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
@Slf4j
public class SpringAiImageDescriber implements ImageDescriber {

    static final String NO_DESCRIPTION = "No description returned.";

    private final ChatClient visionChatClient;

    @Override
    public String describe(byte[] jpeg, String model, String prompt) {
        log.debug("Describing image bytes={} model={}", jpeg.length, model);
        String content = visionChatClient.prompt()
                .options(ChatOptions.builder().model(model).build())
                .user(user -> user
                        .text(prompt)
                        .media(MimeTypeUtils.IMAGE_JPEG, new ByteArrayResource(jpeg)))
                .call()
                .content();
        return StringUtils.hasText(content) ? content : NO_DESCRIPTION;
    }
}
