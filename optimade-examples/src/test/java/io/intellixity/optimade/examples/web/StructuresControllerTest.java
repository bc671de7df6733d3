package io.intellixity.optimade.examples.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
final class StructuresControllerTest {
  @Autowired
  MockMvc mvc;

  @Test
  void firstPage_reportsTotalAndNextLink() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "nelements=2").param("page_limit", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(2))
        .andExpect(jsonPath("$.data[0].id").value("example_2"))
        .andExpect(jsonPath("$.data[0].type").value("structures"))
        .andExpect(jsonPath("$.data[1].id").value("example_3"))
        .andExpect(jsonPath("$.meta.data_returned").value(5))
        .andExpect(jsonPath("$.meta.more_data_available").value(true))
        .andExpect(jsonPath("$.meta.api_version").value("1.0.0"))
        .andExpect(jsonPath("$.links.next").value(containsString("page_cursor=")));
  }

  @Test
  void cursor_continuesWhereThePreviousPageEnded() throws Exception {
    // offset:2
    mvc.perform(get("/v1/structures")
            .param("filter", "nelements=2")
            .param("page_limit", "2")
            .param("page_cursor", "b2Zmc2V0OjI"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].id").value("example_4"))
        .andExpect(jsonPath("$.data[1].id").value("example_6"))
        .andExpect(jsonPath("$.meta.more_data_available").value(true));
  }

  @Test
  void lastPage_hasNoNextLink() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "nelements=2").param("page_offset", "4"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(1))
        .andExpect(jsonPath("$.data[0].id").value("example_7"))
        .andExpect(jsonPath("$.meta.more_data_available").value(false))
        .andExpect(jsonPath("$.links.next").value(nullValue()));
  }

  @Test
  void aliasedProviderField_filtersAndSorts() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "_exmpl_band_gap > 5").param("sort", "-_exmpl_band_gap"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.meta.data_returned").value(2))
        .andExpect(jsonPath("$.data[0].id").value("example_3"))
        .andExpect(jsonPath("$.data[0].attributes._exmpl_band_gap").value(8.8))
        .andExpect(jsonPath("$.data[0].attributes.band_gap").doesNotExist())
        .andExpect(jsonPath("$.data[1].id").value("example_2"));
  }

  @Test
  void lengthOfElements_usesNelements() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "elements LENGTH 4"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.meta.data_returned").value(1))
        .andExpect(jsonPath("$.data[0].id").value("example_5"));
  }

  @Test
  void responseFields_restrictAttributes() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "id=\"example_1\"").param("response_fields", "elements"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].id").value("example_1"))
        .andExpect(jsonPath("$.data[0].attributes.elements[0]").value("Si"))
        .andExpect(jsonPath("$.data[0].attributes.nsites").doesNotExist());
  }

  @Test
  void unknownField_isAWarningNotAnError() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "foo = 1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(0))
        .andExpect(jsonPath("$.meta.data_returned").value(0))
        .andExpect(jsonPath("$.meta.warnings[0].detail").value(containsString("foo")));
  }

  @Test
  void singleEntry_returnsOneResource() throws Exception {
    mvc.perform(get("/v1/structures/example_3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.id").value("example_3"))
        .andExpect(jsonPath("$.data.attributes.chemical_formula_reduced").value("Al2O3"))
        .andExpect(jsonPath("$.meta.data_returned").value(1))
        .andExpect(jsonPath("$.meta.more_data_available").value(false));
  }

  @Test
  void singleEntry_missingIdGivesNullData() throws Exception {
    mvc.perform(get("/v1/structures/example_99"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data").value(nullValue()))
        .andExpect(jsonPath("$.meta.data_returned").value(0));
  }

  @Test
  void pageLimitAboveMax_isForbidden() throws Exception {
    mvc.perform(get("/v1/structures").param("page_limit", "501"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.errors[0].status").value("403"))
        .andExpect(jsonPath("$.errors[0].title").value("Forbidden"));
  }

  @Test
  void syntaxError_isBadRequest() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "nelements="))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].status").value("400"));
  }

  @Test
  void nonNumericPageLimit_isBadRequest() throws Exception {
    mvc.perform(get("/v1/structures").param("page_limit", "many"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].status").value("400"));
  }

  @Test
  void propertyToPropertyComparison_isNotImplemented() throws Exception {
    mvc.perform(get("/v1/structures").param("filter", "nsites > nelements"))
        .andExpect(status().isNotImplemented())
        .andExpect(jsonPath("$.errors[0].status").value("501"))
        .andExpect(jsonPath("$.errors[0].detail").value(containsString("property")));
  }
}
