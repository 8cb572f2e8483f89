package se.fishmarket_be.dto.request;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UpdateUserRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("explicit null marks the field as present")
    void explicitNull() throws Exception {
        UpdateUserRequest request = objectMapper.readValue("{\"phone\":null}", UpdateUserRequest.class);

        assertThat(request.hasPhone()).isTrue();
        assertThat(request.getPhone()).isNull();
        assertThat(request.hasAvatarUrl()).isFalse();
        assertThat(request.hasFullName()).isFalse();
    }

    @Test
    @DisplayName("absent fields stay unset")
    void absentFields() throws Exception {
        UpdateUserRequest request = objectMapper.readValue("{\"fullName\":\"Tran Thi B\"}", UpdateUserRequest.class);

        assertThat(request.hasFullName()).isTrue();
        assertThat(request.hasPhone()).isFalse();
        assertThat(request.hasAvatarUrl()).isFalse();
    }

    @Test
    @DisplayName("ad update mask tracks clearable fields the same way")
    void adUpdateMask() throws Exception {
        AdUpdateRequest request = objectMapper.readValue("{\"title\":\"Betta\",\"images\":[]}", AdUpdateRequest.class);

        assertThat(request.hasTitle()).isTrue();
        assertThat(request.hasImages()).isTrue();
        assertThat(request.getImages()).isEmpty();
        assertThat(request.hasPrice()).isFalse();
    }
}
