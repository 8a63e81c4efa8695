package com.plantwatch.service.notification;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailChannelConfig implements ChannelConfig {

    private static final Pattern ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private String address;

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (ChannelConfig.isBlank(address)) {
            problems.add("address is required");
        } else if (!ADDRESS.matcher(address).matches()) {
            problems.add("address is not a valid email address");
        }
        return problems;
    }
}
