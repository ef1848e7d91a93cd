package com.localllm.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant
    }

    private Role role;
    private String content;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }
}
