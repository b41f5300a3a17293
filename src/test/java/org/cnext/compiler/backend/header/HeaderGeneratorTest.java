package org.cnext.compiler.backend.header;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the layout of generated headers.
 */
public class HeaderGeneratorTest {

    @Test
    @Tag("unit")
    void sectionsAppearInFixedOrderInsideTheGuard() {
        HeaderModel model = new HeaderModel();
        model.addPrototype("void Motor_start(void);");
        model.addExtern("extern uint8_t Motor_speed;");
        model.addRegisterMacro("#define GPIO_DR (*(volatile uint32_t*)(0x40000000U + 0x00U))");
        model.addType("typedef enum {\n    Mode_IDLE = 0\n} Mode;");
        model.addInclude("#include \"board.h\"");
        model.addInclude("#include \"board.h\"");

        String header = new HeaderGenerator().render("motor_control.h", model);

        assertThat(header).startsWith("#ifndef MOTOR_CONTROL_H\n#define MOTOR_CONTROL_H\n");
        assertThat(header).endsWith("#endif /* MOTOR_CONTROL_H */\n");
        assertThat(header.indexOf("#include \"board.h\"")).isEqualTo(header.lastIndexOf("#include \"board.h\""));
        int include = header.indexOf("#include <stdint.h>");
        int type = header.indexOf("typedef enum");
        int macro = header.indexOf("#define GPIO_DR");
        int extern = header.indexOf("extern uint8_t");
        int prototype = header.indexOf("void Motor_start");
        assertThat(include).isLessThan(type);
        assertThat(type).isLessThan(macro);
        assertThat(macro).isLessThan(extern);
        assertThat(extern).isLessThan(prototype);
    }

    @Test
    @Tag("unit")
    void guardNamesAreValidIdentifiers() {
        assertThat(HeaderGenerator.guardName("led-driver.v2.h")).isEqualTo("LED_DRIVER_V2_H");
        assertThat(HeaderGenerator.guardName("7seg.h")).isEqualTo("_7SEG_H");
    }
}
