package com.formpilot.infrastructure.browser;

import com.formpilot.domain.form.model.FieldSet;
import com.formpilot.domain.form.model.FieldType;
import com.formpilot.domain.form.surface.ContainerHandle;
import com.formpilot.domain.form.surface.FieldHandle;
import com.formpilot.domain.form.surface.FormSurface;
import com.formpilot.domain.form.surface.FormSurfaceException;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@link FormSurface} over a Google Forms page in Chrome.
 */
@Slf4j
@Component
public class SeleniumFormSurface implements FormSurface {

    private static final List<String> CONTAINER_SELECTORS = List.of(
            "[role='listitem']",
            "[data-params]",
            ".freebirdFormviewerViewNumberedItemContainer"
    );

    private static final List<String> LABEL_SELECTORS = List.of(
            "[role='heading']",
            ".freebirdFormviewerComponentsQuestionBaseTitle",
            ".freebirdFormviewerComponentsQuestionBaseHeader"
    );

    private static final Map<FieldType, By> FIELD_LOCATORS = new EnumMap<>(Map.of(
            FieldType.TEXT, By.cssSelector(
                    "input[type='text'], input[type='email'], input[type='tel'], input[type='number']"),
            FieldType.TEXTAREA, By.tagName("textarea"),
            FieldType.RADIO, By.cssSelector("[role='radio'], input[type='radio']"),
            FieldType.CHECKBOX, By.cssSelector("[role='checkbox'], input[type='checkbox']"),
            FieldType.SELECT, By.tagName("select")
    ));

    private final WebDriver driver;

    @Value("${form-filler.browser.wait-timeout:10s}")
    private Duration waitTimeout = Duration.ofSeconds(10);

    public SeleniumFormSurface(@Lazy WebDriver driver) {
        this.driver = driver;
    }

    record SeleniumContainer(WebElement element) implements ContainerHandle {}

    record SeleniumField(WebElement element) implements FieldHandle {}

    @Override
    public List<ContainerHandle> listQuestionContainers() {
        try {
            new WebDriverWait(driver, waitTimeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector("[role='listitem'], [data-params]")));
        } catch (TimeoutException e) {
            log.debug("[Browser] No question containers appeared within {}s", waitTimeout.toSeconds());
        } catch (WebDriverException e) {
            throw new FormSurfaceException("Cannot read the current page", e);
        }

        try {
            for (String selector : CONTAINER_SELECTORS) {
                List<WebElement> elements = driver.findElements(By.cssSelector(selector));
                if (!elements.isEmpty()) {
                    return elements.stream()
                            .<ContainerHandle>map(SeleniumContainer::new)
                            .toList();
                }
            }
            return List.of();
        } catch (WebDriverException e) {
            throw new FormSurfaceException("Cannot list question containers", e);
        }
    }

    @Override
    public String extractLabel(ContainerHandle container) {
        WebElement element = element(container);
        for (String selector : LABEL_SELECTORS) {
            try {
                String text = element.findElement(By.cssSelector(selector)).getText().strip();
                if (!text.isEmpty()) {
                    return text;
                }
            } catch (NoSuchElementException e) {
                log.trace("[Browser] Label selector {} not present", selector);
            }
        }

        String text = element.getText();
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.strip().split("\\R", 2)[0];
    }

    @Override
    public FieldSet extractFields(ContainerHandle container) {
        WebElement element = element(container);
        Map<FieldType, List<FieldHandle>> fields = new EnumMap<>(FieldType.class);
        FIELD_LOCATORS.forEach((type, locator) -> fields.put(type, element.findElements(locator).stream()
                .<FieldHandle>map(SeleniumField::new)
                .toList()));
        return new FieldSet(fields);
    }

    @Override
    public String readFieldValue(FieldHandle field) {
        WebElement element = element(field);
        if ("select".equalsIgnoreCase(element.getTagName())) {
            List<WebElement> selected = new Select(element).getAllSelectedOptions();
            return selected.isEmpty() ? "" : selected.get(0).getText().strip();
        }

        String value = element.getAttribute("value");
        if ((value == null || value.isEmpty()) && "textarea".equalsIgnoreCase(element.getTagName())) {
            value = element.getText();
        }
        return value == null ? "" : value;
    }

    @Override
    public boolean setFieldValue(FieldHandle field, String value) {
        WebElement element = element(field);
        element.clear();
        element.sendKeys(value);
        return true;
    }

    @Override
    public String optionLabel(FieldHandle field) {
        WebElement element = element(field);
        String aria = element.getAttribute("aria-label");
        if (aria != null && !aria.isBlank()) {
            return aria;
        }
        String dataValue = element.getAttribute("data-value");
        if (dataValue != null && !dataValue.isBlank()) {
            return dataValue;
        }
        String text = element.getText();
        return text == null ? "" : text.strip();
    }

    @Override
    public boolean isSelected(FieldHandle field) {
        WebElement element = element(field);
        // role-based options are divs, their state lives in aria-checked
        String ariaChecked = element.getAttribute("aria-checked");
        if (ariaChecked != null) {
            return Boolean.parseBoolean(ariaChecked);
        }
        return element.isSelected();
    }

    @Override
    public List<String> listOptions(FieldHandle select) {
        return new Select(element(select)).getOptions().stream()
                .map(option -> option.getText().strip())
                .toList();
    }

    @Override
    public boolean clickOption(FieldHandle field, String label) {
        WebElement element = element(field);
        if ("select".equalsIgnoreCase(element.getTagName())) {
            new Select(element).selectByVisibleText(label);
        } else {
            element.click();
        }
        return true;
    }

    @Override
    public String currentPageUrl() {
        try {
            return driver.getCurrentUrl();
        } catch (WebDriverException e) {
            throw new FormSurfaceException("Browser is not reachable", e);
        }
    }

    private static WebElement element(ContainerHandle container) {
        return ((SeleniumContainer) container).element();
    }

    private static WebElement element(FieldHandle field) {
        return ((SeleniumField) field).element();
    }
}
